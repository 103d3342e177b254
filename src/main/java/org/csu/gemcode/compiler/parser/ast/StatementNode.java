package org.csu.gemcode.compiler.parser.ast;

public interface StatementNode extends AstNode {
}
