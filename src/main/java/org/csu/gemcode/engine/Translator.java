package org.csu.gemcode.engine;

import lombok.Getter;
import org.csu.gemcode.common.config.CompilerOptions;
import org.csu.gemcode.compiler.codegen.PythonCodeGenerator;
import org.csu.gemcode.compiler.lexer.Lexer;
import org.csu.gemcode.compiler.lexer.Token;
import org.csu.gemcode.compiler.parser.Parser;
import org.csu.gemcode.compiler.parser.ast.ProgramNode;

import java.util.List;

/**
 * 编译流水线入口: 词法分析 -> 语法分析 -> 代码生成。
 * 每次调用都新建各阶段对象，调用之间不共享可变状态。
 */
public class Translator {

    @Getter
    private final CompilerOptions options;

    public Translator() {
        this(new CompilerOptions());
    }

    public Translator(CompilerOptions options) {
        this.options = options;
    }

    /**
     * 将 GemCode 源文本翻译为 Python 源文本
     *
     * @throws org.csu.gemcode.common.exception.LexException 遇到无法识别的字符
     * @throws org.csu.gemcode.common.exception.ParseException 语法错误
     */
    public String compile(String source) {
        ProgramNode program = parse(source);
        return new PythonCodeGenerator(options).generate(program);
    }

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public ProgramNode parse(String source) {
        return new Parser(tokenize(source)).parse();
    }
}
