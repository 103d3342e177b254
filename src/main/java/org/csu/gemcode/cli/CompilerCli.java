package org.csu.gemcode.cli;

import org.csu.gemcode.cli.tool.AstPrinter;
import org.csu.gemcode.common.exception.CompileException;
import org.csu.gemcode.compiler.lexer.Token;
import org.csu.gemcode.engine.Translator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * @description: 命令行驱动
 *
 * 读取源文件，翻译后写入输出文件或打印到标准输出。
 * 所有错误都只打印一行提示，不写输出文件，进程也不以非零状态退出。
 */
public class CompilerCli {

    private final Translator translator;
    private final PrintStream out;

    public CompilerCli(Translator translator, PrintStream out) {
        this.translator = translator;
        this.out = out;
    }

    public static void main(String[] args) {
        new CompilerCli(new Translator(), System.out).run(args);
    }

    public void run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            CliArguments.printUsage(out);
            return;
        }

        try {
            Path sourcePath = Path.of(arguments.getSourceFile());
            if (!Files.isRegularFile(sourcePath)) {
                out.println("Error: File '" + arguments.getSourceFile() + "' not found.");
                return;
            }
            String source = Files.readString(sourcePath, StandardCharsets.UTF_8);
            if (arguments.isDumpTokens()) {
                for (Token token : translator.tokenize(source)) {
                    out.printf("%d:%d\t%s%n", token.line(), token.column(), token);
                }
            }
            if (arguments.isDumpAst()) {
                out.println(new AstPrinter().print(translator.parse(source)));
            }
            String generated = translator.compile(source);
            if (arguments.hasOutputFile()) {
                Files.writeString(Path.of(arguments.getOutputFile()), generated, StandardCharsets.UTF_8);
                out.println("Compiled " + arguments.getSourceFile() + " -> " + arguments.getOutputFile());
            } else {
                out.print(generated);
            }
        } catch (CompileException | IOException | InvalidPathException e) {
            out.println("Error: " + e.getMessage());
        }
    }
}
