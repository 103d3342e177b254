package org.csu.gemcode.compiler.parser.ast.expression;

import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个变量引用
 */
public record IdentifierNode(String name) implements ExpressionNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
