package org.csu.gemcode.compiler.parser.ast.statement;

import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.ExpressionNode;
import org.csu.gemcode.compiler.parser.ast.StatementNode;

/**
 * AST 节点: name = value;
 */
public record AssignmentStatementNode(String name, ExpressionNode value) implements StatementNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignmentStatement(this);
    }
}
