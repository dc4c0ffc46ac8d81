package com.naturaltime.plugin.arithmetic;

import com.naturaltime.config.Constants;
import com.naturaltime.plugin.TimeFormatException;
import com.naturaltime.plugin.TimePlugin;
import com.naturaltime.token.TimeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 解析 GNU date 风格的相对时间表达式，如 "15 years -12 months 2 fortnights ago"。
 * 
 * 分词是全有或全无的：任一片段无法识别时整个输入返回空列表。
 */
public class ArithmeticTimePlugin implements TimePlugin {
    private static final Logger logger = LoggerFactory.getLogger(ArithmeticTimePlugin.class);

    public static final String KEY = Constants.ARITHMETIC_PLUGIN_KEY;

    private final UnitVocabulary supportedUnits;

    /**
     * 创建使用默认英文词表的插件。
     */
    public ArithmeticTimePlugin() {
        this(new UnitVocabulary());
    }

    public ArithmeticTimePlugin(UnitVocabulary supportedUnits) {
        this.supportedUnits = Objects.requireNonNull(supportedUnits, "supportedUnits");
    }

    /**
     * 返回本实例独占的可变词表，用于追加本地化别名。
     */
    public UnitVocabulary getSupportedUnits() {
        return supportedUnits;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public List<TimeToken> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        try {
            return new ExpressionParser(supportedUnits, KEY).parse(text);
        } catch (ExpressionParseException exception) {
            logger.debug("无法识别相对时间表达式: {}", exception.getMessage());
            return List.of();
        }
    }

    @Override
    public LocalDateTime apply(TimeToken token, LocalDateTime base) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(base, "base");

        return switch (token.unit()) {
            case SECONDS -> base.plusSeconds(token.magnitude());
            case MINUTES -> base.plusMinutes(token.magnitude());
            case HOURS -> base.plusHours(token.magnitude());
            case DAYS -> base.plusDays(token.magnitude());
            case WEEKS -> base.plusDays(Math.multiplyExact(token.magnitude(), Constants.DAYS_PER_WEEK));
            case FORTNIGHTS -> base.plusDays(Math.multiplyExact(token.magnitude(), Constants.DAYS_PER_FORTNIGHT));
            case MONTHS -> CalendarMath.plusMonths(base, token.magnitude());
            case YEARS -> CalendarMath.plusYears(base, token.magnitude());
            case UNKNOWN -> throw new TimeFormatException("无法识别的时间单位", token);
        };
    }
}
