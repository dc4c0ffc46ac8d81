package com.naturaltime.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析器运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class ParserConfig {
    private String timestampPattern = Constants.DEFAULT_TIMESTAMP_PATTERN;
    private String outputFormat = "text";
    private int maxExpressionLength = Constants.MAX_EXPRESSION_LENGTH;
    private List<Path> vocabularyFiles = new ArrayList<>();
    private Map<String, String> extraAliases = new LinkedHashMap<>();

    public String getTimestampPattern() {
        return timestampPattern;
    }

    public void setTimestampPattern(String timestampPattern) {
        this.timestampPattern = timestampPattern;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public int getMaxExpressionLength() {
        return maxExpressionLength;
    }

    public void setMaxExpressionLength(int maxExpressionLength) {
        this.maxExpressionLength = maxExpressionLength;
    }

    public List<Path> getVocabularyFiles() {
        return vocabularyFiles;
    }

    public void setVocabularyFiles(List<Path> vocabularyFiles) {
        this.vocabularyFiles = vocabularyFiles == null ? new ArrayList<>() : new ArrayList<>(vocabularyFiles);
    }

    public Map<String, String> getExtraAliases() {
        return extraAliases;
    }

    public void setExtraAliases(Map<String, String> extraAliases) {
        this.extraAliases = extraAliases == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extraAliases);
    }

    /**
     * 是否以JSON格式输出
     */
    public boolean isJsonOutput() {
        return "json".equalsIgnoreCase(outputFormat);
    }

    /**
     * 使用默认配置创建实例
     */
    public static ParserConfig defaults() {
        return new ParserConfig();
    }
}
