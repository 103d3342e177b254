package org.csu.gemcode.compiler;

import org.csu.gemcode.common.exception.ParseException;
import org.csu.gemcode.compiler.lexer.Lexer;
import org.csu.gemcode.compiler.lexer.Token;
import org.csu.gemcode.compiler.lexer.TokenType;
import org.csu.gemcode.compiler.parser.Parser;
import org.csu.gemcode.compiler.parser.ast.ExpressionNode;
import org.csu.gemcode.compiler.parser.ast.ProgramNode;
import org.csu.gemcode.compiler.parser.ast.StatementNode;
import org.csu.gemcode.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.gemcode.compiler.parser.ast.expression.BinaryOperator;
import org.csu.gemcode.compiler.parser.ast.expression.DataType;
import org.csu.gemcode.compiler.parser.ast.expression.IdentifierNode;
import org.csu.gemcode.compiler.parser.ast.expression.LiteralNode;
import org.csu.gemcode.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.gemcode.compiler.parser.ast.statement.BlockNode;
import org.csu.gemcode.compiler.parser.ast.statement.PrintStatementNode;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Parser 类的单元测试
 */
public class ParserTest {

    private ProgramNode parse(String source) {
        System.out.println("Input source: " + source);
        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Tokens: " + tokens);
        ProgramNode ast = new Parser(tokens).parse();
        System.out.println("Generated AST: " + ast);
        return ast;
    }

    private ExpressionNode assignedValue(String source) {
        ProgramNode program = parse(source);
        assertEquals(1, program.body().size());
        return ((AssignmentStatementNode) program.body().get(0)).value();
    }

    private static IdentifierNode id(String name) {
        return new IdentifierNode(name);
    }

    private static BinaryExpressionNode bin(BinaryOperator op, ExpressionNode left, ExpressionNode right) {
        return new BinaryExpressionNode(op, left, right);
    }

    @Test
    void testParseAssignment() {
        System.out.println("--- Running test: testParseAssignment ---");
        ProgramNode program = parse("x = 10;");

        assertEquals(1, program.body().size());
        StatementNode statement = program.body().get(0);
        assertInstanceOf(AssignmentStatementNode.class, statement);
        AssignmentStatementNode assignment = (AssignmentStatementNode) statement;
        assertEquals("x", assignment.name());
        assertEquals(new LiteralNode(BigInteger.TEN, DataType.INTEGER), assignment.value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testParsePrintOfString() {
        ProgramNode program = parse("print(\"Hello, world!\");");

        PrintStatementNode print = (PrintStatementNode) program.body().get(0);
        assertEquals(LiteralNode.ofString("Hello, world!"), print.expression());
    }

    @Test
    void testLiteralTagsFollowLexicalForm() {
        ProgramNode program = parse("a = 1; b = 1.5; c = \"1\";");

        assertEquals(DataType.INTEGER, ((LiteralNode) ((AssignmentStatementNode) program.body().get(0)).value()).dataType());
        assertEquals(DataType.FLOAT, ((LiteralNode) ((AssignmentStatementNode) program.body().get(1)).value()).dataType());
        assertEquals(DataType.STRING, ((LiteralNode) ((AssignmentStatementNode) program.body().get(2)).value()).dataType());
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        System.out.println("--- Running test: testMultiplicationBindsTighterThanAddition ---");
        ExpressionNode value = assignedValue("r = a + b * c;");

        assertEquals(bin(BinaryOperator.PLUS, id("a"), bin(BinaryOperator.MULTIPLY, id("b"), id("c"))), value);
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        ExpressionNode value = assignedValue("r = a - b - c;");

        assertEquals(bin(BinaryOperator.MINUS, bin(BinaryOperator.MINUS, id("a"), id("b")), id("c")), value);
    }

    @Test
    void testDivisionAndMultiplicationAreLeftAssociative() {
        ExpressionNode value = assignedValue("r = a / b * c;");

        assertEquals(bin(BinaryOperator.MULTIPLY, bin(BinaryOperator.DIVIDE, id("a"), id("b")), id("c")), value);
    }

    @Test
    void testParenthesesOverridePrecedence() {
        ExpressionNode value = assignedValue("r = (a + b) * c;");

        assertEquals(bin(BinaryOperator.MULTIPLY, bin(BinaryOperator.PLUS, id("a"), id("b")), id("c")), value);
    }

    @Test
    void testParseNestedBlocks() {
        System.out.println("--- Running test: testParseNestedBlocks ---");
        ProgramNode program = parse("{ x = 1; { print(x); } } y = 2;");

        assertEquals(2, program.body().size());
        BlockNode outer = (BlockNode) program.body().get(0);
        assertEquals(2, outer.body().size());
        assertInstanceOf(AssignmentStatementNode.class, outer.body().get(0));
        BlockNode inner = (BlockNode) outer.body().get(1);
        assertEquals(List.of(new PrintStatementNode(id("x"))), inner.body());
        assertInstanceOf(AssignmentStatementNode.class, program.body().get(1));
    }

    @Test
    void testEmptyProgramAndEmptyBlock() {
        assertTrue(parse("").body().isEmpty());

        ProgramNode program = parse("{}");
        assertTrue(((BlockNode) program.body().get(0)).body().isEmpty());
    }

    @Test
    void testProgramBodyIsImmutable() {
        ProgramNode program = parse("x = 1;");

        assertThrows(UnsupportedOperationException.class, () -> program.body().add(new BlockNode(List.of())));
    }

    @Test
    void testMissingSemicolon() {
        System.out.println("--- Running test: testMissingSemicolon ---");
        ParseException e = assertThrows(ParseException.class, () -> parse("x = 10"));

        assertEquals("Expected SEMICOLON, got EOF", e.getMessage());
        assertEquals(TokenType.EOF, e.getToken().type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testIfStatementIsNotSupported() {
        ParseException e = assertThrows(ParseException.class, () -> parse("if (x) { print(x); }"));

        assertEquals("Unexpected token: Token[Type=KEYWORD, Lexeme='if']", e.getMessage());
        assertEquals("if", e.getToken().lexeme());
    }

    @Test
    void testErrorAfterValidStatementsAbortsWholeParse() {
        ParseException e = assertThrows(ParseException.class, () -> parse("x = 1; print(x); while"));

        assertEquals("while", e.getToken().lexeme());
    }

    @Test
    void testUnclosedParenthesis() {
        ParseException e = assertThrows(ParseException.class, () -> parse("print(x;"));

        assertEquals("Expected RPAREN, got SEMICOLON", e.getMessage());
    }

    @Test
    void testUnclosedBlock() {
        ParseException e = assertThrows(ParseException.class, () -> parse("{ x = 1;"));

        assertEquals("Expected RBRACE, got EOF", e.getMessage());
    }

    @Test
    void testStrayClosingBrace() {
        ParseException e = assertThrows(ParseException.class, () -> parse("}"));

        assertEquals("Unexpected token: Token[Type=RBRACE, Lexeme='}']", e.getMessage());
    }

    @Test
    void testMissingOperand() {
        ParseException e = assertThrows(ParseException.class, () -> parse("x = ;"));

        assertEquals("Unexpected token: Token[Type=SEMICOLON, Lexeme=';']", e.getMessage());
    }

    @Test
    void testMissingAssignOperator() {
        ParseException e = assertThrows(ParseException.class, () -> parse("x 5;"));

        assertEquals("Expected ASSIGN, got INTEGER", e.getMessage());
    }

    @Test
    void testPrintRequiresParentheses() {
        ParseException e = assertThrows(ParseException.class, () -> parse("print 5;"));

        assertEquals("Expected LPAREN, got INTEGER", e.getMessage());
    }

    @Test
    void testEqualityOperatorIsNotPartOfTheGrammar() {
        ParseException e = assertThrows(ParseException.class, () -> parse("x = a == b;"));

        assertEquals("Expected SEMICOLON, got OPERATOR", e.getMessage());
    }

    // 嵌套很深的输入不打印 Token 流，直接分析
    private ProgramNode parseQuietly(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    @Test
    void testDeeplyNestedParenthesesAreRejected() {
        System.out.println("--- Running test: testDeeplyNestedParenthesesAreRejected ---");
        String source = "x = " + "(".repeat(200_000) + "1" + ")".repeat(200_000) + ";";

        ParseException e = assertThrows(ParseException.class, () -> parseQuietly(source));

        assertEquals("Expression nested too deeply (more than 1000 levels)", e.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLongOperatorChainIsRejected() {
        String source = "x = 1" + " + 1".repeat(200_000) + ";";

        ParseException e = assertThrows(ParseException.class, () -> parseQuietly(source));

        assertTrue(e.getMessage().startsWith("Expression nested too deeply"));
    }

    @Test
    void testDeeplyNestedBlocksAreRejected() {
        String source = "{".repeat(200_000) + "}".repeat(200_000);

        ParseException e = assertThrows(ParseException.class, () -> parseQuietly(source));

        assertEquals("Blocks nested too deeply (more than 1000 levels)", e.getMessage());
    }

    @Test
    void testNestingWithinLimitIsAccepted() {
        ProgramNode program = parseQuietly("x = " + "(".repeat(500) + "a + b" + ")".repeat(500) + ";"
                + "{".repeat(500) + "print(x);" + "}".repeat(500));

        assertEquals(bin(BinaryOperator.PLUS, id("a"), id("b")),
                ((AssignmentStatementNode) program.body().get(0)).value());
        assertEquals(2, program.body().size());
    }
}
