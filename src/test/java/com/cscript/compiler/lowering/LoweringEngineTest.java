package com.cscript.compiler.lowering;

import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.EnumDeclaration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LoweringEngine and the function, binding and enum rules.
 */
class LoweringEngineTest {

    private final LoweringEngine engine = new LoweringEngine();
    private final Configuration config = Configuration.defaults();

    @Test
    void testExpressionFunction() {
        LoweringResult result = engine.lower("fn add(int a, int b) -> int => a + b;", config);

        assertThat(result.getText()).isEqualTo("static inline int add(int a, int b){ return (a + b); }");
        assertThat(result.getRewriteCounts()).containsEntry("expression-function", 1);
    }

    @Test
    void testMultiLineExpressionFunctionKeepsLaterLines() {
        String source = "fn f(int a)\n  -> int\n  => a;\nint y;";

        String lowered = engine.lower(source, config).getText();

        assertThat(lowered).isEqualTo("static inline int f(int a){ return (a); }\n\n\nint y;");
    }

    @Test
    void testBlockFunction() {
        String source = "fn square(int x) -> int {\n    return x * x;\n}\n";

        String lowered = engine.lower(source, config).getText();

        assertThat(lowered).isEqualTo("int square(int x){\n    return x * x;\n}\n");
    }

    @Test
    void testBindings() {
        String lowered = engine.lower("let int x = 1;\nvar int y = 2;\n", config).getText();

        assertThat(lowered).isEqualTo("const int x = 1;\nint y = 2;\n");
    }

    @Test
    void testSugarInsideStringsAndCommentsIsUntouched() {
        String source = "puts(\"let x = fn\"); // match (x) { _ => y; }\nint letter = 1;\n/* enum! E { A } */\n";

        LoweringResult result = engine.lower(source, config);

        assertThat(result.getText()).isEqualTo(source);
        assertThat(result.totalRewrites()).isZero();
    }

    @Test
    void testTaggedEnum() {
        LoweringResult result = engine.lower("enum! Color { Red, Green = 4, Blue };\nint x;", config);

        assertThat(result.getText())
                .startsWith("typedef enum Color { Red, Green = 4, Blue } Color;")
                .contains("static inline int cs__enum_is_valid_Color(int cs__value){ return cs__value == (int)Red"
                        + " || cs__value == (int)Green || cs__value == (int)Blue; }")
                .contains("CS_ENUM_CHECK(cs__enum_is_valid_Color(cs__value), \"Color\", cs__value);")
                .endsWith("}\nint x;");

        assertThat(result.getEnumDeclarations()).hasSize(1);
        EnumDeclaration color = result.getEnumDeclarations().get(0);
        assertThat(color.getName()).isEqualTo("Color");
        assertThat(color.variantNames()).containsExactly("Red", "Green", "Blue");
        assertThat(color.getVariants().get(1).getExplicitValue()).contains("4");
        assertThat(color.getLine()).isEqualTo(1);
        assertThat(color.isFlags()).isFalse();
    }

    @Test
    void testMultiLineEnumKeepsLineCount() {
        String source = "enum! Color {\n  Red,\n  Green,\n}\nint x;";

        LoweringResult result = engine.lower(source, config);

        assertThat(result.getText().split("\n", -1)).hasSize(5);
        assertThat(result.getText()).endsWith("\nint x;");
        assertThat(result.getEnumDeclarations().get(0).variantNames()).containsExactly("Red", "Green");
    }

    @Test
    void testFlagEnum() {
        LoweringResult result = engine.lower("enum_flags! Perm { Read = 1, Write = 2 }", config);

        assertThat(result.getText())
                .startsWith("typedef enum Perm { Read = 1, Write = 2 } Perm;")
                .contains("static inline Perm Perm_combine(Perm a, Perm b)")
                .contains("static inline int Perm_has(Perm flags, Perm flag)");
        assertThat(result.getEnumDeclarations().get(0).isFlags()).isTrue();
    }

    @Test
    void testSoftlineOffIsIdentity() {
        String source = "fn add(int a, int b) -> int => a + b;\nenum! E { A };\n";
        Configuration off = Configuration.builder().softline(false).build();

        LoweringResult result = engine.lower(source, off);

        assertThat(result.getText()).isEqualTo(source);
        assertThat(result.getEnumDeclarations()).isEmpty();
    }

    @Test
    void testLoweringIsIdempotent() {
        String source = """
            enum! Color { Red, Green, Blue };
            fn twice(int x) -> int => x * 2;
            fn pick(Color c) -> int {
                let int base = twice(1);
                var int out = 0;
                match (c) {
                    Red | Green => out = base;
                    _ => { out = -1; }
                }
                return out;
            }
            """;

        String once = engine.lower(source, config).getText();
        LoweringResult twice = engine.lower(once, config);

        assertThat(twice.getText()).isEqualTo(once);
        assertThat(twice.totalRewrites()).isZero();
        assertThat(once.split("\n", -1)).hasSameSizeAs(source.split("\n", -1));
    }

    @Test
    void testUnsafeBlock() {
        String source = "void f(long v) {\n    int r;\n    @unsafe { r = v; }\n}\n";

        LoweringResult result = engine.lower(source, config);

        assertThat(result.getText())
                .isEqualTo("void f(long v) {\n    int r;\n    { CS_UNSAFE_BEGIN; r = v; CS_UNSAFE_END; }\n}\n");
        assertThat(result.getRewriteCounts()).containsEntry("unsafe-block", 1);
    }

    @Test
    void testNestedUnsafeBlocksWithSugarInside() {
        String source = "@unsafe {\n    let int a = 1;\n    @unsafe {x = a;}\n}\nint after;";

        String lowered = engine.lower(source, config).getText();

        assertThat(lowered).isEqualTo("{ CS_UNSAFE_BEGIN;\n    const int a = 1;\n"
                + "    { CS_UNSAFE_BEGIN; x = a; CS_UNSAFE_END; }\nCS_UNSAFE_END; }\nint after;");
    }

    @Test
    void testUnsafeBraceOnNextLineKeepsLineCount() {
        String source = "@unsafe\n{ x = 1; }\ny = 2;";

        String lowered = engine.lower(source, config).getText();

        assertThat(lowered).isEqualTo("{ CS_UNSAFE_BEGIN;\n x = 1; CS_UNSAFE_END; }\ny = 2;");
    }

    @Test
    void testUnsafeWithoutBlockIsLeftAlone() {
        String source = "@unsafe x = 1;\nint unsafe = 0;\n";

        LoweringResult result = engine.lower(source, config);

        assertThat(result.getText()).isEqualTo(source);
        assertThat(result.totalRewrites()).isZero();
    }

    @Test
    void testSoftlineOffLeavesUnsafeBlock() {
        String source = "@unsafe { r = v; }\n";

        String lowered = engine.lower(source, Configuration.builder().softline(false).build()).getText();

        assertThat(lowered).isEqualTo(source);
    }
}
