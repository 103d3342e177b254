package org.csu.gemcode.compiler.codegen;

import org.csu.gemcode.common.config.CompilerOptions;
import org.csu.gemcode.compiler.parser.ast.AstVisitor;
import org.csu.gemcode.compiler.parser.ast.ProgramNode;
import org.csu.gemcode.compiler.parser.ast.StatementNode;
import org.csu.gemcode.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.gemcode.compiler.parser.ast.expression.IdentifierNode;
import org.csu.gemcode.compiler.parser.ast.expression.LiteralNode;
import org.csu.gemcode.compiler.parser.ast.statement.AssignmentStatementNode;
import org.csu.gemcode.compiler.parser.ast.statement.BlockNode;
import org.csu.gemcode.compiler.parser.ast.statement.PrintStatementNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * @description: 目标代码生成器
 *
 * 遍历 AST 生成 Python 源码。语句节点返回其生成的若干行（以换行分隔），
 * 表达式节点返回表达式文本。二元表达式一律加括号，保持源程序的求值分组。
 */
public class PythonCodeGenerator implements AstVisitor<String> {

    private static final String LINE_SEPARATOR = "\n";

    private final CompilerOptions options;
    private int indentLevel = 0;

    public PythonCodeGenerator(CompilerOptions options) {
        this.options = options;
    }

    public PythonCodeGenerator() {
        this(new CompilerOptions());
    }

    public String generate(ProgramNode program) {
        indentLevel = 0;
        return program.accept(this);
    }

    @Override
    public String visitProgram(ProgramNode node) {
        List<String> lines = new ArrayList<>();
        lines.add(options.headerComment());
        lines.add("");
        String body = generateStatements(node.body());
        if (!body.isEmpty()) {
            lines.add(body);
        }
        return String.join(LINE_SEPARATOR, lines) + LINE_SEPARATOR;
    }

    @Override
    public String visitPrintStatement(PrintStatementNode node) {
        return indent() + "print(" + node.expression().accept(this) + ")";
    }

    @Override
    public String visitAssignmentStatement(AssignmentStatementNode node) {
        return indent() + node.name() + " = " + node.value().accept(this);
    }

    @Override
    public String visitBlock(BlockNode node) {
        indentLevel++;
        try {
            return generateStatements(node.body());
        } finally {
            indentLevel--;
        }
    }

    @Override
    public String visitBinaryExpression(BinaryExpressionNode node) {
        return "(" + node.left().accept(this)
                + " " + node.operator().symbol() + " "
                + node.right().accept(this) + ")";
    }

    @Override
    public String visitLiteral(LiteralNode node) {
        switch (node.dataType()) {
            case STRING:
                // 不做转义，原样包回双引号
                return "\"" + node.value() + "\"";
            case INTEGER:
                return node.value().toString();
            case FLOAT:
                return formatFloat((Double) node.value());
            default:
                throw new IllegalStateException("Unknown literal type: " + node.dataType());
        }
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.name();
    }

    // 空块不产生任何行
    private String generateStatements(List<StatementNode> statements) {
        List<String> lines = new ArrayList<>();
        for (StatementNode statement : statements) {
            String text = statement.accept(this);
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        return String.join(LINE_SEPARATOR, lines);
    }

    /**
     * 按 Python repr 的规则输出小数: 十进制指数在 [-4, 16) 内用普通写法并保留 ".0"，
     * 其余用 1e+20、1.5e-05 这样的科学计数法。
     */
    static String formatFloat(double value) {
        // valueOf 走 Double.toString，得到最短的可往返十进制数字
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        String digits = decimal.unscaledValue().abs().toString();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        String sign = decimal.signum() < 0 ? "-" : "";
        return String.format("%s%se%s%02d", sign, mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }

    private String indent() {
        return options.getIndentUnit().repeat(indentLevel);
    }
}
