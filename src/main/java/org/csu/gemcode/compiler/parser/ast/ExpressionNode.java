package org.csu.gemcode.compiler.parser.ast;

public interface ExpressionNode extends AstNode {
}
