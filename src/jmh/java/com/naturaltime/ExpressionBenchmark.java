package com.naturaltime;

import com.naturaltime.plugin.TimeResolver;
import com.naturaltime.plugin.arithmetic.ArithmeticTimePlugin;
import com.naturaltime.token.RelativeTimeUnit;
import com.naturaltime.token.TimeToken;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 分词与日历计算性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ExpressionBenchmark {

    @State(Scope.Thread)
    public static class PluginState {
        ArithmeticTimePlugin plugin;
        TimeResolver resolver;
        LocalDateTime base;
        String longExpression;

        @Setup
        public void setup() {
            plugin = new ArithmeticTimePlugin();
            plugin.getSupportedUnits().put("heure", RelativeTimeUnit.HOURS);
            resolver = new TimeResolver(plugin);
            base = LocalDateTime.of(2000, 1, 31, 12, 0);
            // 100个片段的长表达式
            longExpression = "-3 days ago 2 heures +months ".repeat(33) + "secs";
        }
    }

    @Benchmark
    public List<TimeToken> tokenizeShort(PluginState state) {
        return state.plugin.tokenize("15 years -12 months 2 fortnights ago");
    }

    @Benchmark
    public List<TimeToken> tokenizeRejected(PluginState state) {
        return state.plugin.tokenize("four eggs ago 15 days ago");
    }

    @Benchmark
    public List<TimeToken> tokenizeLong(PluginState state) {
        return state.plugin.tokenize(state.longExpression);
    }

    @Benchmark
    public LocalDateTime resolveChain(PluginState state) {
        return state.resolver.resolve("1 year 13 months -2 weeks 36 hours", state.base).orElseThrow();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(ExpressionBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
