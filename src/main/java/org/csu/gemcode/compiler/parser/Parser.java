package org.csu.gemcode.compiler.parser;

import org.csu.gemcode.common.exception.ParseException;
import org.csu.gemcode.compiler.lexer.Token;
import org.csu.gemcode.compiler.lexer.TokenType;
import org.csu.gemcode.compiler.parser.ast.ExpressionNode;
import org.csu.gemcode.compiler.parser.ast.ProgramNode;
import org.csu.gemcode.compiler.parser.ast.StatementNode;
import org.csu.gemcode.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.gemcode.compiler.parser.ast.expression.BinaryOperator;
import org.csu.gemcode.compiler.parser.ast.expression.IdentifierNode;
import org.csu.gemcode.compiler.parser.ast.expression.LiteralNode;
import org.csu.gemcode.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.gemcode.compiler.parser.ast.statement.BlockNode;
import org.csu.gemcode.compiler.parser.ast.statement.PrintStatementNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。
 * 只看一个前瞻Token，不回溯；第一个错误即终止整个分析。
 *
 * <pre>
 * Program    -> Statement* EOF
 * Statement  -> PrintStmt | AssignStmt | Block
 * PrintStmt  -> 'print' '(' Expression ')' ';'
 * AssignStmt -> IDENTIFIER '=' Expression ';'
 * Block      -> '{' Statement* '}'
 * Expression -> Term (('+' | '-') Term)*
 * Term       -> Factor (('*' | '/') Factor)*
 * Factor     -> INTEGER | FLOAT | STRING | IDENTIFIER | '(' Expression ')'
 * </pre>
 */
public class Parser {

    // 括号、代码块和运算符链的最大嵌套层数
    static final int MAX_NESTING_DEPTH = 1000;

    private final List<Token> tokens;
    private int position = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public ProgramNode parse() {
        List<StatementNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(parseStatement());
        }
        consume(TokenType.EOF);
        return new ProgramNode(body);
    }

    private StatementNode parseStatement() {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD && "print".equals(token.lexeme())) {
            return parsePrintStatement();
        }
        if (token.type() == TokenType.IDENTIFIER) {
            return parseAssignmentStatement();
        }
        if (token.type() == TokenType.LBRACE) {
            return parseBlock();
        }
        throw new ParseException(token);
    }

    private PrintStatementNode parsePrintStatement() {
        consume(TokenType.KEYWORD);
        consume(TokenType.LPAREN);
        ExpressionNode expression = parseExpression();
        consume(TokenType.RPAREN);
        consume(TokenType.SEMICOLON);
        return new PrintStatementNode(expression);
    }

    private AssignmentStatementNode parseAssignmentStatement() {
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.ASSIGN);
        ExpressionNode value = parseExpression();
        consume(TokenType.SEMICOLON);
        return new AssignmentStatementNode(name.lexeme(), value);
    }

    private BlockNode parseBlock() {
        consume(TokenType.LBRACE);
        enterNesting("Blocks");
        List<StatementNode> body = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            body.add(parseStatement());
        }
        consume(TokenType.RBRACE);
        exitNesting();
        return new BlockNode(body);
    }

    private ExpressionNode parseExpression() {
        return parseSum().node();
    }

    private Operand parseSum() {
        Operand left = parseTerm();
        while (matchOperator("+", "-")) {
            BinaryOperator operator = BinaryOperator.fromSymbol(previous().lexeme());
            left = combine(operator, left, parseTerm());
        }
        return left;
    }

    private Operand parseTerm() {
        Operand left = parseFactor();
        while (matchOperator("*", "/")) {
            BinaryOperator operator = BinaryOperator.fromSymbol(previous().lexeme());
            left = combine(operator, left, parseFactor());
        }
        return left;
    }

    private Operand parseFactor() {
        if (match(TokenType.INTEGER)) {
            return Operand.leaf(LiteralNode.ofInteger((BigInteger) previous().value()));
        }
        if (match(TokenType.FLOAT)) {
            return Operand.leaf(LiteralNode.ofFloat((Double) previous().value()));
        }
        if (match(TokenType.STRING)) {
            return Operand.leaf(LiteralNode.ofString((String) previous().value()));
        }
        if (match(TokenType.IDENTIFIER)) {
            return Operand.leaf(new IdentifierNode(previous().lexeme()));
        }
        if (match(TokenType.LPAREN)) {
            enterNesting("Expression");
            Operand expr = parseSum();
            consume(TokenType.RPAREN);
            exitNesting();
            return expr;
        }
        throw new ParseException(peek());
    }

    // 左折叠不走递归，但生成的树同样要限制深度，否则后续遍历会栈溢出
    private Operand combine(BinaryOperator operator, Operand left, Operand right) {
        int depth = Math.max(left.depth(), right.depth()) + 1;
        if (depth > MAX_NESTING_DEPTH) {
            throw tooDeep("Expression");
        }
        return new Operand(new BinaryExpressionNode(operator, left.node(), right.node()), depth);
    }

    private void enterNesting(String what) {
        if (++nesting > MAX_NESTING_DEPTH) {
            throw tooDeep(what);
        }
    }

    private void exitNesting() {
        nesting--;
    }

    private ParseException tooDeep(String what) {
        return new ParseException(previous(), what + " nested too deeply (more than " + MAX_NESTING_DEPTH + " levels)");
    }

    /**
     * 表达式节点及其树高
     */
    private record Operand(ExpressionNode node, int depth) {
        static Operand leaf(ExpressionNode node) {
            return new Operand(node, 0);
        }
    }

    // --- 辅助方法 ---

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOperator(String... symbols) {
        if (!check(TokenType.OPERATOR)) {
            return false;
        }
        for (String symbol : symbols) {
            if (symbol.equals(peek().lexeme())) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type) {
        if (peek().type() == type) return advance();
        throw new ParseException(type, peek());
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    // EOF 永远不会被越过
    private Token advance() {
        Token current = peek();
        if (!isAtEnd()) position++;
        return current;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
