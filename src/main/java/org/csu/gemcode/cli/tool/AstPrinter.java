package org.csu.gemcode.cli.tool;

import org.csu.gemcode.compiler.parser.ast.AstNode;
import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.ProgramNode;
import org.csu.gemcode.compiler.parser.ast.StatementNode;
import org.csu.gemcode.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.gemcode.compiler.parser.ast.expression.IdentifierNode;
import org.csu.gemcode.compiler.parser.ast.expression.LiteralNode;
import org.csu.gemcode.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.gemcode.compiler.parser.ast.statement.BlockNode;
import org.csu.gemcode.compiler.parser.ast.statement.PrintStatementNode;

import java.util.List;

/**
 * 调试工具: 把 AST 打印成带括号的前缀形式，供命令行 --ast 使用。
 * e.g. {@code (program (assign z (+ x y)) (print z))}
 */
public class AstPrinter implements AstVisitor<String> {

    public String print(AstNode node) {
        return node.accept(this);
    }

    @Override
    public String visitProgram(ProgramNode node) {
        return parenthesize("program", node.body());
    }

    @Override
    public String visitPrintStatement(PrintStatementNode node) {
        return "(print " + node.expression().accept(this) + ")";
    }

    @Override
    public String visitAssignmentStatement(AssignmentStatementNode node) {
        return "(assign " + node.name() + " " + node.value().accept(this) + ")";
    }

    @Override
    public String visitBlock(BlockNode node) {
        return parenthesize("block", node.body());
    }

    @Override
    public String visitBinaryExpression(BinaryExpressionNode node) {
        return "(" + node.operator().symbol() + " "
                + node.left().accept(this) + " "
                + node.right().accept(this) + ")";
    }

    @Override
    public String visitLiteral(LiteralNode node) {
        switch (node.dataType()) {
            case STRING:
                return "\"" + node.value() + "\"";
            case FLOAT:
                return node.value() + "f";
            default:
                return String.valueOf(node.value());
        }
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.name();
    }

    private String parenthesize(String name, List<StatementNode> statements) {
        StringBuilder builder = new StringBuilder();
        builder.append("(").append(name);
        for (StatementNode statement : statements) {
            builder.append(" ").append(statement.accept(this));
        }
        return builder.append(")").toString();
    }
}
