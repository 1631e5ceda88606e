package org.csu.mathsolve.compiler.lexer;

import org.csu.mathsolve.common.exception.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的算术表达式分解为一系列的Token。
 * 先去掉所有空白字符，再在每个位置上按最长匹配扫描，不回溯。
 * 没有可变的共享状态，可以在多个线程中同时使用同一个实例。
 */
public class Lexer {

    /**
     * 主方法，执行词法分析并返回所有Token
     * @param input 已经过纠错的 ASCII 表达式
     * @return 不可修改的Token列表
     * @throws LexException 遇到无法识别的字符时
     */
    public List<Token> tokenize(String input) {
        return new Scan(input).run();
    }

    /**
     * 单次扫描的游标状态，每次 tokenize 都新建一个
     */
    private static final class Scan {

        private final String text;     // 去掉空白后的文本
        private final int[] origin;    // text 中每个字符在原始输入中的下标
        private int position = 0;

        Scan(String input) {
            StringBuilder sb = new StringBuilder(input.length());
            int[] offsets = new int[input.length()];
            for (int i = 0; i < input.length(); i++) {
                char ch = input.charAt(i);
                if (!Character.isWhitespace(ch)) {
                    offsets[sb.length()] = i;
                    sb.append(ch);
                }
            }
            this.text = sb.toString();
            this.origin = offsets;
        }

        List<Token> run() {
            List<Token> tokens = new ArrayList<>();
            while (position < text.length()) {
                tokens.add(nextToken());
            }
            return Collections.unmodifiableList(tokens);
        }

        private Token nextToken() {
            char currentChar = peek();

            // 识别数字
            if (isDigit(currentChar)) {
                return readNumber();
            }

            // 识别运算符和括号
            switch (currentChar) {
                case '+':
                    return consumeAndReturn(TokenType.PLUS);
                case '-':
                    return consumeAndReturn(TokenType.MINUS);
                case '*':
                    return consumeAndReturn(TokenType.MULTIPLY);
                case '/':
                    return consumeAndReturn(TokenType.DIVIDE);
                case '(':
                    return consumeAndReturn(TokenType.LPAREN);
                case ')':
                    return consumeAndReturn(TokenType.RPAREN);
                default:
                    throw new LexException(currentChar, origin[position]);
            }
        }

        private Token readNumber() {
            int startPos = position;
            while (position < text.length() && isDigit(peek())) {
                position++;
            }
            // 小数点后面必须还有数字，否则 '.' 留给下一轮并被判为非法字符
            if (position < text.length() && peek() == '.' && isDigit(peekNext())) {
                position++; // 消耗掉 '.'
                while (position < text.length() && isDigit(peek())) {
                    position++;
                }
            }
            return new Token(TokenType.NUMBER, text.substring(startPos, position), origin[startPos]);
        }

        // --- 辅助方法 ---

        private char peek() {
            return text.charAt(position);
        }

        private char peekNext() {
            if (position + 1 >= text.length()) return '\0';
            return text.charAt(position + 1);
        }

        private Token consumeAndReturn(TokenType type) {
            Token token = new Token(type, String.valueOf(peek()), origin[position]);
            position++;
            return token;
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }
    }
}
