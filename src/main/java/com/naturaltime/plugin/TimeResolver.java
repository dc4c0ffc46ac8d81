package com.naturaltime.plugin;

import com.naturaltime.token.TimeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 使用单个插件解析表达式，并按顺序把时间依次传递给每个 token。
 */
public class TimeResolver {
    private static final Logger logger = LoggerFactory.getLogger(TimeResolver.class);

    private final TimePlugin plugin;

    public TimeResolver(TimePlugin plugin) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
    }

    public TimePlugin getPlugin() {
        return plugin;
    }

    /**
     * 解析表达式并应用到基准时间；表达式无法识别时返回 empty。
     */
    public Optional<LocalDateTime> resolve(String expression, LocalDateTime base) {
        Objects.requireNonNull(base, "base");
        List<TimeToken> tokens = plugin.tokenize(expression);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(applyAll(tokens, base));
    }

    /**
     * 按输入顺序依次应用 token。
     */
    public LocalDateTime applyAll(List<TimeToken> tokens, LocalDateTime base) {
        LocalDateTime current = base;
        for (TimeToken token : tokens) {
            current = plugin.apply(token, current);
        }
        logger.debug("已应用 {} 个 token: {} -> {}", tokens.size(), base, current);
        return current;
    }
}
