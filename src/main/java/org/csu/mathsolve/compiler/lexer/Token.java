package org.csu.mathsolve.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param position 在原始输入中的起始下标
 */
public record Token(TokenType type, String lexeme, int position) {

    @Override
    public String toString() {
        // 与 "[12,NUMBER]" 这种写法保持一致，方便调试和打印
        return "[" + lexeme + "," + type + "]";
    }
}
