package org.csu.gemcode.compiler.parser.ast;

/**
 * 所有 AST 节点的公共接口
 */
public interface AstNode {

    <R> R accept(AstVisitor<R> visitor);
}
