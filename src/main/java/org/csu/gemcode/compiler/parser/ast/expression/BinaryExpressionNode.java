package org.csu.gemcode.compiler.parser.ast.expression;

import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x + 1)
 */
public record BinaryExpressionNode(
        BinaryOperator operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
