package org.csu.gemcode.compiler.parser.ast.expression;

/**
 * 字面量的数据类型标签，与词法形式一一对应
 */
public enum DataType {
    INTEGER,
    FLOAT,
    STRING
}
