package com.naturaltime.plugin.arithmetic;

/**
 * 词法 token，记录原文区间以及前面是否有空白。
 */
record LexToken(TokenType type, String value, int start, int end, boolean precededBySpace) {
}

enum TokenType {
    PLUS,
    MINUS,
    NUMBER,
    WORD,
    EOF
}
