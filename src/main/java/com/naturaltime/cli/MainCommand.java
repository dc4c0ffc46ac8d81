package com.naturaltime.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.datatype.jsr310.ser.LocalDateTimeSerializer;
import com.naturaltime.config.Constants;
import com.naturaltime.config.ParserConfig;
import com.naturaltime.plugin.TimeResolver;
import com.naturaltime.plugin.arithmetic.ArithmeticTimePlugin;
import com.naturaltime.token.TimeToken;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "reltime",
    description = "⏱️ GNU date 风格相对时间表达式解析器",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.TokenizeSubcommand.class,
        MainCommand.ApplySubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--alias"}, description = "追加单位别名，例如 heure=Hours（可指定多个）")
    private Map<String, String> aliases;

    @Option(names = {"--vocabulary"}, description = "JSON 别名文件路径（可指定多个）")
    private List<Path> vocabularyFiles;

    @Option(names = {"--pattern"}, description = "时间戳输出格式（text 与 json 输出均生效）", defaultValue = Constants.DEFAULT_TIMESTAMP_PATTERN)
    private String timestampPattern;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("⏱️ GNU date 风格相对时间表达式解析器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并全局选项与子命令选项。
     */
    ParserConfig buildConfig(String format) {
        ParserConfig config = ParserConfig.defaults();
        config.setVocabularyFiles(vocabularyFiles);
        config.setExtraAliases(aliases);
        if (timestampPattern != null) {
            config.setTimestampPattern(timestampPattern);
        }
        if (format != null) {
            config.setOutputFormat(format);
        }
        return config;
    }

    /**
     * 按配置创建插件，并写入本地化别名。
     */
    static ArithmeticTimePlugin createPlugin(ParserConfig config) throws IOException {
        ArithmeticTimePlugin plugin = new ArithmeticTimePlugin();
        VocabularyLoader loader = new VocabularyLoader();
        for (Path file : config.getVocabularyFiles()) {
            loader.load(file, plugin.getSupportedUnits());
        }
        VocabularyLoader.apply(config.getExtraAliases(), plugin.getSupportedUnits());
        return plugin;
    }

    private String sanitizeExpression(List<String> words, ParserConfig config) {
        if (words == null || words.isEmpty()) {
            return "";
        }
        String joined = String.join(" ", words).trim();
        if (joined.length() > config.getMaxExpressionLength()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "表达式长度超过限制（最大 " + config.getMaxExpressionLength() + " 字符）");
        }
        return joined;
    }

    private static String representation(List<TimeToken> tokens) {
        StringBuilder builder = new StringBuilder();
        for (TimeToken token : tokens) {
            builder.append(token.representation());
        }
        return builder.toString();
    }

    /**
     * 以 JSON 输出报告，时间戳按 --pattern 格式化。
     */
    static void printJson(ExpressionReport report, ParserConfig config) throws IOException {
        JavaTimeModule timeModule = new JavaTimeModule();
        timeModule.addSerializer(LocalDateTime.class,
            new LocalDateTimeSerializer(DateTimeFormatter.ofPattern(config.getTimestampPattern())));
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(timeModule);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    }

    @Command(name = "tokenize", description = "🔤 将表达式切分为相对时间 token（以 - 开头的表达式请放在 -- 之后）")
    static class TokenizeSubcommand implements Callable<Integer> {

        @Parameters(description = "相对时间表达式", arity = "1..*")
        private List<String> words;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                ParserConfig config = main.buildConfig(format);
                String expression = main.sanitizeExpression(words, config);
                List<TimeToken> tokens = createPlugin(config).tokenize(expression);

                if (config.isJsonOutput()) {
                    printJson(ExpressionReport.of(expression, tokens, null, null), config);
                } else if (tokens.isEmpty()) {
                    System.out.println("⚠️ 无法识别表达式: \"" + expression + "\"");
                } else {
                    System.out.println(representation(tokens));
                }
                return tokens.isEmpty() ? 1 : 0;
            } catch (Exception exception) {
                System.err.println("❌ 分词失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "apply", description = "🕒 将表达式应用到基准时间（以 - 开头的表达式请放在 -- 之后）")
    static class ApplySubcommand implements Callable<Integer> {

        @Parameters(description = "相对时间表达式", arity = "1..*")
        private List<String> words;

        @Option(names = {"-b", "--base"}, description = "基准时间 (ISO-8601，如 2000-01-01T00:00:00)，默认当前时间")
        private String base;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                ParserConfig config = main.buildConfig(format);
                String expression = main.sanitizeExpression(words, config);
                LocalDateTime baseTime = base == null ? LocalDateTime.now() : LocalDateTime.parse(base);
                TimeResolver resolver = new TimeResolver(createPlugin(config));

                List<TimeToken> tokens = resolver.getPlugin().tokenize(expression);
                if (tokens.isEmpty()) {
                    if (config.isJsonOutput()) {
                        printJson(ExpressionReport.of(expression, tokens, baseTime, null), config);
                    } else {
                        System.out.println("⚠️ 无法识别表达式: \"" + expression + "\"");
                    }
                    return 1;
                }

                LocalDateTime result = resolver.applyAll(tokens, baseTime);
                if (config.isJsonOutput()) {
                    printJson(ExpressionReport.of(expression, tokens, baseTime, result), config);
                } else {
                    DateTimeFormatter formatter = DateTimeFormatter.ofPattern(config.getTimestampPattern());
                    System.out.println("🔤 Token: " + representation(tokens));
                    System.out.println("🕒 基准: " + formatter.format(baseTime));
                    System.out.println("✅ 结果: " + formatter.format(result));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 计算失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
