package com.naturaltime.plugin.arithmetic;

import com.naturaltime.config.Constants;
import com.naturaltime.token.RelativeTimeUnit;
import com.naturaltime.token.TimeToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 相对时间表达式的递归下降解析器。
 *
 * <pre>
 * expression = occurrence { WS occurrence }
 * occurrence = [ "+" | "-" ] [ NUMBER ] WORD [ WS "ago" ]
 * </pre>
 *
 * 整个输入必须被完整消费，任一位置失败都会抛出 {@link ExpressionParseException}。
 */
class ExpressionParser {

    private final UnitVocabulary vocabulary;
    private final String sourceKey;

    private List<LexToken> tokens;
    private int pos;
    private String expression;

    ExpressionParser(UnitVocabulary vocabulary, String sourceKey) {
        this.vocabulary = vocabulary;
        this.sourceKey = sourceKey;
    }

    /**
     * 解析完整表达式，按输入顺序返回 token；空白输入返回空列表。
     */
    List<TimeToken> parse(String input) {
        this.expression = input;
        this.tokens = new ExpressionLexer().tokenize(input);
        this.pos = 0;

        List<TimeToken> result = new ArrayList<>();
        while (current().type() != TokenType.EOF) {
            if (!result.isEmpty() && !current().precededBySpace()) {
                throw new ExpressionParseException("相邻表达式之间缺少空白", current().start(), expression);
            }
            result.add(parseOccurrence());
        }
        return List.copyOf(result);
    }

    /**
     * 解析单个 occurrence：可选符号、可选数值、单位、可选 ago。
     */
    private TimeToken parseOccurrence() {
        int occurrenceStart = current().start();

        boolean negative = false;
        boolean hasSign = false;
        if (current().type() == TokenType.PLUS || current().type() == TokenType.MINUS) {
            negative = advance().type() == TokenType.MINUS;
            hasSign = true;
        }

        long magnitude = Constants.DEFAULT_MAGNITUDE;
        boolean hasNumber = false;
        if (current().type() == TokenType.NUMBER) {
            if (hasSign && current().precededBySpace()) {
                throw new ExpressionParseException("符号必须紧邻数值", current().start(), expression);
            }
            magnitude = parseMagnitude(advance());
            hasNumber = true;
        }

        LexToken unitToken = current();
        if (unitToken.type() != TokenType.WORD) {
            throw new ExpressionParseException("缺少时间单位", unitToken.start(), expression);
        }
        if (hasSign && !hasNumber && unitToken.precededBySpace()) {
            throw new ExpressionParseException("符号必须紧邻时间单位", unitToken.start(), expression);
        }
        RelativeTimeUnit unit = resolveUnit(unitToken.value())
                .orElseThrow(() -> new ExpressionParseException(
                        "未知时间单位: " + unitToken.value(), unitToken.start(), expression));
        advance();

        int occurrenceEnd = unitToken.end();
        if (isAgoKeyword(current())) {
            negative = !negative;
            occurrenceEnd = advance().end();
        }

        long value = negative ? -magnitude : magnitude;
        return new TimeToken(sourceKey, expression.substring(occurrenceStart, occurrenceEnd), Long.toString(value), unit);
    }

    /**
     * 查找单位别名，未命中时去掉一个复数后缀再查一次。
     */
    private Optional<RelativeTimeUnit> resolveUnit(String alias) {
        Optional<RelativeTimeUnit> unit = vocabulary.lookup(alias);
        if (unit.isPresent() || alias.length() < 2) {
            return unit;
        }
        char last = Character.toLowerCase(alias.charAt(alias.length() - 1));
        if (last != Constants.PLURAL_SUFFIX) {
            return unit;
        }
        return vocabulary.lookup(alias.substring(0, alias.length() - 1));
    }

    private long parseMagnitude(LexToken numberToken) {
        try {
            return Long.parseLong(numberToken.value());
        } catch (NumberFormatException exception) {
            throw new ExpressionParseException("数值超出范围: " + numberToken.value(), numberToken.start(), expression);
        }
    }

    private boolean isAgoKeyword(LexToken token) {
        return token.type() == TokenType.WORD
                && token.precededBySpace()
                && Constants.AGO_KEYWORD.equals(token.value().toLowerCase(Locale.ROOT));
    }

    private LexToken current() {
        return tokens.get(pos);
    }

    private LexToken advance() {
        return tokens.get(pos++);
    }
}
