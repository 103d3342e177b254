package org.csu.gemcode.compiler.parser.ast.statement;

import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.StatementNode;

import java.util.List;

/**
 * AST 节点: { statement* }
 * 目前没有任何控制流语句使用它，只影响生成代码的缩进。
 */
public record BlockNode(List<StatementNode> body) implements StatementNode {

    public BlockNode {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
