package com.naturaltime.token;

import java.util.Objects;

/**
 * 插件分词产生的时间 token。
 *
 * @param sourceKey      产生该 token 的插件标识
 * @param rawMatchedText 本次匹配消费的原文，手工构造时可为 null
 * @param magnitudeText  带符号整数倍数的十进制文本
 * @param unit           时间单位
 */
public record TimeToken(
    String sourceKey,
    String rawMatchedText,
    String magnitudeText,
    RelativeTimeUnit unit
) {

    public TimeToken {
        Objects.requireNonNull(sourceKey, "sourceKey");
        Objects.requireNonNull(magnitudeText, "magnitudeText");
        Objects.requireNonNull(unit, "unit");
        try {
            Long.parseLong(magnitudeText);
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("倍数必须是带符号整数: " + magnitudeText, exception);
        }
    }

    /**
     * 以指定倍数构造 token，不携带原文。
     */
    public static TimeToken of(String sourceKey, long magnitude, RelativeTimeUnit unit) {
        return new TimeToken(sourceKey, null, Long.toString(magnitude), unit);
    }

    /**
     * 解析带符号倍数。
     */
    public long magnitude() {
        return Long.parseLong(magnitudeText);
    }

    /**
     * 返回 "[Years:15]" 形式的紧凑表示。
     */
    public String representation() {
        return "[" + unit.displayName() + ":" + magnitudeText + "]";
    }
}
