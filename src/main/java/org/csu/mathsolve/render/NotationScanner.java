package org.csu.mathsolve.render;

import java.util.ArrayList;
import java.util.List;

/**
 * 渲染用的简单切分器，独立于 Lexer。
 * 去掉空白后，把运算符和括号各自切成单字符，其余字符的最长连续片段当作一个数字。
 */
final class NotationScanner {

    private static final String DELIMITERS = "+-*/()";

    private NotationScanner() {
    }

    static List<String> scan(String expression) {
        List<String> parts = new ArrayList<>();
        StringBuilder number = new StringBuilder();
        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (Character.isWhitespace(ch)) {
                continue;
            }
            if (isDelimiter(ch)) {
                if (number.length() > 0) {
                    parts.add(number.toString());
                    number.setLength(0);
                }
                parts.add(String.valueOf(ch));
            } else {
                number.append(ch);
            }
        }
        if (number.length() > 0) {
            parts.add(number.toString());
        }
        return parts;
    }

    static boolean isDelimiter(String part) {
        return part.length() == 1 && isDelimiter(part.charAt(0));
    }

    private static boolean isDelimiter(char ch) {
        return DELIMITERS.indexOf(ch) >= 0;
    }
}
