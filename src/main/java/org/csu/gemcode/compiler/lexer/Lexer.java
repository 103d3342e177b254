package org.csu.gemcode.compiler.lexer;

import org.csu.gemcode.common.exception.LexException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将 GemCode 源文本分解为一系列的Token。
 * 单次前向扫描，不回溯；遇到无法识别的字符立即抛出 {@link LexException}。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字集合，区分大小写
    private static final Set<String> KEYWORDS = Set.of(
            "print", "if", "else", "while", "for", "return", "int", "float", "string"
    );

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，以且仅以一个 EOF 结尾
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", null, line, column);
        }

        char currentChar = peek();

        // 识别标识符或关键字
        if (isIdentifierStart(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '"') {
            return readString();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.OPERATOR, "+");
            case '-':
                return consumeAndReturn(TokenType.OPERATOR, "-");
            case '*':
                return consumeAndReturn(TokenType.OPERATOR, "*");
            case '/':
                return consumeAndReturn(TokenType.OPERATOR, "/");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '{':
                return consumeAndReturn(TokenType.LBRACE, "{");
            case '}':
                return consumeAndReturn(TokenType.RBRACE, "}");
            case '=':
                if (peekNext() == '=') {
                    int startCol = column;
                    advance(); // consume first '='
                    advance(); // consume second '='
                    return new Token(TokenType.OPERATOR, "==", "==", line, startCol);
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            default:
                throw new LexException("Unrecognized character: " + currentChar,
                        String.valueOf(currentChar), line, column);
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return new Token(type, text, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        boolean sawDot = false;
        while (position < input.length() && (isDigit(peek()) || peek() == '.')) {
            if (peek() == '.') {
                sawDot = true;
            }
            advance();
        }
        String number = input.substring(startPos, position);
        if (!sawDot) {
            return new Token(TokenType.INTEGER, number, new BigInteger(number), line, startCol);
        }
        // "5." 按 5.0 处理；多个小数点或溢出为无穷大时报错
        try {
            double value = Double.parseDouble(number);
            if (Double.isInfinite(value)) {
                throw new NumberFormatException("out of range: " + number);
            }
            return new Token(TokenType.FLOAT, number, value, line, startCol);
        } catch (NumberFormatException e) {
            throw new LexException("Malformed number: " + number, number, line, startCol);
        }
    }

    private Token readString() {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的双引号
        int startPos = position;
        while (position < input.length() && peek() != '"') {
            if (peek() == '\n') {
                line++;
                column = 0;
            }
            advance();
        }
        String text = input.substring(startPos, position);
        // 未闭合的字符串一直读到输入结束
        if (position < input.length()) {
            advance(); // 跳过结束的双引号
        }
        return new Token(TokenType.STRING, text, text, startLine, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (isSpace(ch)) {
                advance();
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, lexeme, line, column);
        advance();
        return token;
    }

    // isSpaceChar 补上 U+00A0 这类不换行空格
    private boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
