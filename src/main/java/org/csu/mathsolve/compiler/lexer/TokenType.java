package org.csu.mathsolve.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 算术表达式中只有数字、四则运算符和括号三类“单词”。
 */
public enum TokenType {
    // ---- 常量 (Constants) ----
    NUMBER,     // 整数或小数, e.g., 12, 3.14

    // ---- 运算符 (Operators) ----
    PLUS,       // +
    MINUS,      // -
    MULTIPLY,   // *
    DIVIDE,     // /

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN;     // )

    public boolean isOperator() {
        return this == PLUS || this == MINUS || this == MULTIPLY || this == DIVIDE;
    }
}
