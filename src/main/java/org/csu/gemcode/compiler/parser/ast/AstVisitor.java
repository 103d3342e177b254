package org.csu.gemcode.compiler.parser.ast;

import org.csu.gemcode.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.gemcode.compiler.parser.ast.expression.IdentifierNode;
import org.csu.gemcode.compiler.parser.ast.expression.LiteralNode;
import org.csu.gemcode.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.gemcode.compiler.parser.ast.statement.BlockNode;
import org.csu.gemcode.compiler.parser.ast.statement.PrintStatementNode;

/**
 * @description: AST 访问者
 * 每种节点恰好对应一个方法，新增节点类型时所有访问者都必须补上实现。
 *
 * @param <R> 访问结果的类型
 */
public interface AstVisitor<R> {

    R visitProgram(ProgramNode node);

    R visitPrintStatement(PrintStatementNode node);

    R visitAssignmentStatement(AssignmentStatementNode node);

    R visitBlock(BlockNode node);

    R visitBinaryExpression(BinaryExpressionNode node);

    R visitLiteral(LiteralNode node);

    R visitIdentifier(IdentifierNode node);
}
