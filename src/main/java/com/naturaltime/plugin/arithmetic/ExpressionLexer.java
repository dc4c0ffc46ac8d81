package com.naturaltime.plugin.arithmetic;

import java.util.ArrayList;
import java.util.List;

class ExpressionLexer {

    /**
     * 将表达式切分为符号、数字与单词 token，末尾追加 EOF。
     */
    List<LexToken> tokenize(String expression) {
        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        boolean sawSpace = false;
        while (index < expression.length()) {
            char currentChar = expression.charAt(index);
            if (isSpace(currentChar)) {
                sawSpace = true;
                index++;
                continue;
            }

            if (currentChar == '+') {
                tokens.add(new LexToken(TokenType.PLUS, "+", index, index + 1, sawSpace));
                index++;
            } else if (currentChar == '-') {
                tokens.add(new LexToken(TokenType.MINUS, "-", index, index + 1, sawSpace));
                index++;
            } else if (isDigit(currentChar)) {
                int tokenStart = index;
                while (index < expression.length() && isDigit(expression.charAt(index))) {
                    index++;
                }
                tokens.add(new LexToken(TokenType.NUMBER, expression.substring(tokenStart, index), tokenStart, index, sawSpace));
            } else {
                int tokenStart = index;
                while (index < expression.length() && isWordChar(expression.charAt(index))) {
                    index++;
                }
                tokens.add(new LexToken(TokenType.WORD, expression.substring(tokenStart, index), tokenStart, index, sawSpace));
            }
            sawSpace = false;
        }

        tokens.add(new LexToken(TokenType.EOF, "", expression.length(), expression.length(), sawSpace));
        return tokens;
    }

    /**
     * 判断字符能否出现在单位别名中。
     */
    static boolean isWordChar(char ch) {
        return !isSpace(ch) && !isDigit(ch) && ch != '+' && ch != '-';
    }

    /**
     * 空白字符，包含不换行空格等 Unicode 空格。
     */
    static boolean isSpace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
