package org.csu.gemcode.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param value 字面值: 文本、BigInteger、Double，EOF 时为 null
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, Object value, int line, int column) {

    /**
     * 便于在错误信息中展示；位置信息不参与输出
     */
    @Override
    public String toString() {
        return String.format("Token[Type=%s, Lexeme='%s']", type, lexeme);
    }
}
