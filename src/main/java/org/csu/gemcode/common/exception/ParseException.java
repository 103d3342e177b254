package org.csu.gemcode.common.exception;

import lombok.Getter;
import org.csu.gemcode.compiler.lexer.Token;
import org.csu.gemcode.compiler.lexer.TokenType;

/**
 * 语法分析阶段的自定义异常
 */
@Getter
public class ParseException extends CompileException {

    private final Token token;

    public ParseException(Token token) {
        super("Unexpected token: " + token);
        this.token = token;
    }

    public ParseException(Token token, String message) {
        super(message);
        this.token = token;
    }

    public ParseException(TokenType expected, Token token) {
        super(String.format("Expected %s, got %s", expected, token.type()));
        this.token = token;
    }
}
