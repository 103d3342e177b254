package org.csu.gemcode.compiler.parser.ast.expression;

import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.ExpressionNode;

import java.math.BigInteger;

/**
 * AST 节点: 表示一个字面量 (整数、小数、字符串)
 *
 * @param value BigInteger、Double 或 String，与 dataType 一致
 */
public record LiteralNode(Object value, DataType dataType) implements ExpressionNode {

    public static LiteralNode ofInteger(BigInteger value) {
        return new LiteralNode(value, DataType.INTEGER);
    }

    public static LiteralNode ofFloat(double value) {
        return new LiteralNode(value, DataType.FLOAT);
    }

    public static LiteralNode ofString(String value) {
        return new LiteralNode(value, DataType.STRING);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
