package com.naturaltime.plugin.arithmetic;

/**
 * 表达式不符合相对时间语法。
 */
public class ExpressionParseException extends RuntimeException {
    private final int position;
    private final String expression;

    public ExpressionParseException(String message, int position, String expression) {
        super(buildMessage(message, position, expression));
        this.position = position;
        this.expression = expression;
    }

    public int getPosition() {
        return position;
    }

    public String getExpression() {
        return expression;
    }

    private static String buildMessage(String message, int pos, String expression) {
        int caretPos = Math.max(0, Math.min(pos, expression.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + expression + System.lineSeparator() + pointer;
    }
}
