package org.csu.gemcode.engine;

import org.csu.gemcode.common.config.CompilerOptions;
import org.csu.gemcode.common.exception.CompileException;
import org.csu.gemcode.common.exception.LexException;
import org.csu.gemcode.common.exception.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试: 源文本 -> Python 文本
 */
public class TranslatorTest {

    private Translator translator;

    @BeforeEach
    void setUp() {
        translator = new Translator();
    }

    @Test
    void testCompileSampleProgram() {
        System.out.println("--- Running test: testCompileSampleProgram ---");
        String source = "x = 10;\ny = 20;\nz = x + y;\nprint(z);\nprint(\"Hello, world!\");\n";

        String output = translator.compile(source);
        System.out.println(output);

        assertEquals("# Generated by GemCode\n"
                + "\n"
                + "x = 10\n"
                + "y = 20\n"
                + "z = (x + y)\n"
                + "print(z)\n"
                + "print(\"Hello, world!\")\n", output);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCompileIsDeterministic() {
        String source = "a = 1.5 * (b - 2) / c; { print(a); print(\"done\"); }";

        assertEquals(translator.compile(source), translator.compile(source));
        assertEquals(translator.compile(source), new Translator().compile(source));
    }

    @Test
    void testPrecedenceInGeneratedText() {
        assertTrue(translator.compile("r = a + b * c;").contains("r = (a + (b * c))"));
        assertTrue(translator.compile("r = a - b - c;").contains("r = ((a - b) - c)"));
        assertTrue(translator.compile("r = (a + b) * c;").contains("r = ((a + b) * c)"));
    }

    @Test
    void testBlockEmitsIndentedStatementsOnly() {
        String output = translator.compile("{ a = 1; print(a); }");

        assertEquals("# Generated by GemCode\n\n    a = 1\n    print(a)\n", output);
        assertFalse(output.contains("{"));
        assertFalse(output.contains("}"));
    }

    @Test
    void testMultiLineSourceWithWhitespace() {
        String output = translator.compile("  total\t=  price*2 ;\r\n\r\nprint( total );");

        assertEquals("# Generated by GemCode\n\ntotal = (price * 2)\nprint(total)\n", output);
    }

    @Test
    void testUnrecognizedCharacter() {
        LexException e = assertThrows(LexException.class, () -> translator.compile("x = 10 @ 5;"));

        assertTrue(e.getMessage().contains("@"));
    }

    @Test
    void testMissingSemicolon() {
        ParseException e = assertThrows(ParseException.class, () -> translator.compile("x = 10"));

        assertEquals("Expected SEMICOLON, got EOF", e.getMessage());
    }

    @Test
    void testIfIsRejectedAtKeyword() {
        ParseException e = assertThrows(ParseException.class, () -> translator.compile("if (x) { print(x); }"));

        assertEquals("if", e.getToken().lexeme());
    }

    @Test
    void testBothErrorKindsShareTheBaseType() {
        assertThrows(CompileException.class, () -> translator.compile("#"));
        assertThrows(CompileException.class, () -> translator.compile("print"));
    }

    @Test
    void testOptionsAreApplied() {
        CompilerOptions options = new CompilerOptions();
        options.setEngineName("Custom Engine");
        Translator custom = new Translator(options);

        assertTrue(custom.compile("").startsWith("# Generated by Custom Engine\n\n"));
        assertSame(options, custom.getOptions());
    }

    @Test
    void testIntermediateStages() {
        assertEquals(5, translator.tokenize("x = 1;").size());
        assertEquals(2, translator.parse("x = 1; print(x);").body().size());
    }
}
