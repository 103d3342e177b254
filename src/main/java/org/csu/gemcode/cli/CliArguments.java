package org.csu.gemcode.cli;

import lombok.Getter;

import java.io.PrintStream;

/**
 * 命令行参数: [--tokens] [--ast] &lt;source&gt; [output]
 */
@Getter
public class CliArguments {

    private final String sourceFile;  // 源文件，必填
    private final String outputFile;  // 输出文件，为 null 时打印到标准输出
    private final boolean dumpTokens;
    private final boolean dumpAst;

    private CliArguments(String sourceFile, String outputFile, boolean dumpTokens, boolean dumpAst) {
        this.sourceFile = sourceFile;
        this.outputFile = outputFile;
        this.dumpTokens = dumpTokens;
        this.dumpAst = dumpAst;
    }

    public boolean hasOutputFile() {
        return outputFile != null;
    }

    /**
     * @throws IllegalArgumentException 参数不合法
     */
    public static CliArguments parse(String[] args) {
        String source = null;
        String output = null;
        boolean tokens = false;
        boolean ast = false;
        for (String arg : args) {
            if ("--tokens".equals(arg)) {
                tokens = true;
                continue;
            }
            if ("--ast".equals(arg)) {
                ast = true;
                continue;
            }
            // detect illegal flags
            if (arg.startsWith("-")) {
                throw new IllegalArgumentException("invalid flag: " + arg);
            }
            if (source == null) {
                source = arg;
            } else if (output == null) {
                output = arg;
            } else {
                throw new IllegalArgumentException("unexpected argument: " + arg);
            }
        }
        if (source == null) {
            throw new IllegalArgumentException("source file should be specified.");
        }
        return new CliArguments(source, output, tokens, ast);
    }

    public static void printUsage(PrintStream out) {
        out.println("Usage: gemcode [--tokens] [--ast] <source_file> [output_file]");
        out.println("  --tokens  print the token stream before translating");
        out.println("  --ast     print the syntax tree before translating");
    }
}
