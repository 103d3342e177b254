package org.csu.gemcode.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * GemCode 源语言中所有可能出现的“单词”的分类。
 * 关键字不再逐个区分种别码，统一归为 KEYWORD，由词素值区分。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    KEYWORD,    // print, if, else, while, for, return, int, float, string

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 变量名

    // ---- 常量 (Constants) ----
    INTEGER,    // 整数常量, e.g., 123
    FLOAT,      // 小数常量, e.g., 123.45
    STRING,     // 字符串常量, e.g., "hello"

    // ---- 运算符 (Operators) ----
    OPERATOR,   // + - * / ==
    ASSIGN,     // =

    // ---- 分隔符 (Delimiters) ----
    SEMICOLON,  // ;
    LPAREN,     // (
    RPAREN,     // )
    LBRACE,     // {
    RBRACE,     // }

    // ---- 特殊 Token ----
    EOF         // End-Of-File，表示输入流结束
}
