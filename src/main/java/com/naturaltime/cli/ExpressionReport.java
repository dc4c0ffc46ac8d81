package com.naturaltime.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.naturaltime.token.TimeToken;

import java.time.LocalDateTime;
import java.util.List;

/**
 * CLI 输出模型，text 与 json 两种格式共用。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpressionReport(
    String expression,
    boolean recognized,
    List<TokenView> tokens,
    LocalDateTime base,
    LocalDateTime result
) {

    public static ExpressionReport of(String expression, List<TimeToken> tokens, LocalDateTime base, LocalDateTime result) {
        List<TokenView> views = tokens.stream().map(TokenView::from).toList();
        return new ExpressionReport(expression, !tokens.isEmpty(), views, base, result);
    }

    public record TokenView(String unit, long magnitude, String matchedText) {

        static TokenView from(TimeToken token) {
            return new TokenView(token.unit().displayName(), token.magnitude(), token.rawMatchedText());
        }
    }
}
