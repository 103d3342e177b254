package org.csu.gemcode.compiler.parser.ast;

import java.util.List;

/**
 * AST 根节点: 一次编译恰好产生一个
 */
public record ProgramNode(List<StatementNode> body) implements AstNode {

    public ProgramNode {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
