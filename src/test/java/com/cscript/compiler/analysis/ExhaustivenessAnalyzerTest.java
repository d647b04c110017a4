package com.cscript.compiler.analysis;

import com.cscript.compiler.exception.TranslationException;
import com.cscript.compiler.lowering.LoweringEngine;
import com.cscript.compiler.lowering.LoweringResult;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.model.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExhaustivenessAnalyzer.
 */
class ExhaustivenessAnalyzerTest {

    private final ExhaustivenessAnalyzer analyzer = new ExhaustivenessAnalyzer();
    private final LoweringEngine engine = new LoweringEngine();

    private List<Diagnostic> analyze(String source) {
        LoweringResult lowered = engine.lower(source, Configuration.defaults());
        return analyzer.analyze(lowered.getText(), lowered.getEnumDeclarations());
    }

    @Test
    void testMissingVariantIsReported() {
        String source = """
            enum! Color { Red, Green, Blue };
            void paint(Color c) {
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Red); break;
                    CS_CASE(Green); break;
                CS_SWITCH_END(Color, c);
            }
            """;

        List<Diagnostic> diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        Diagnostic diagnostic = diagnostics.get(0);
        assertThat(diagnostic.getKind()).isEqualTo(DiagnosticKind.NON_EXHAUSTIVE);
        assertThat(diagnostic.getLine()).isEqualTo(3);
        assertThat(diagnostic.format("paint.csc"))
                .isEqualTo("paint.csc:3: non-exhaustive: missing Blue in switch over enum 'Color'");
    }

    @Test
    void testCompleteRegionPasses() {
        String source = """
            enum! Color { Red, Green, Blue };
            void paint(Color c) {
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Blue); break;
                    CS_CASE(Red); break;
                    CS_CASE(Green); break;
                CS_SWITCH_END(Color, c);
            }
            """;

        assertThat(analyze(source)).isEmpty();
    }

    @Test
    void testForeignVariantAndUnknownEnum() {
        String source = """
            enum! Color { Red, Green };
            void paint(Color c, int s) {
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Red); break;
                    CS_CASE(Green); break;
                    CS_CASE(Purple); break;
                CS_SWITCH_END(Color, c);
                CS_SWITCH_EXHAUSTIVE(Shape, s)
                    CS_CASE(Circle); break;
                CS_SWITCH_END(Shape, s);
            }
            """;

        List<Diagnostic> diagnostics = analyze(source);

        assertThat(diagnostics).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.FOREIGN_VARIANT, DiagnosticKind.UNKNOWN_ENUM);
        assertThat(diagnostics).extracting(Diagnostic::getLine).containsExactly(6, 8);
    }

    @Test
    void testUnterminatedRegion() {
        String source = """
            enum! Color { Red };
            void paint(Color c) {
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Red); break;
            }
            """;

        List<Diagnostic> diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).getKind()).isEqualTo(DiagnosticKind.UNTERMINATED_REGION);
        assertThat(diagnostics.get(0).getLine()).isEqualTo(3);
    }

    @Test
    void testDuplicateEnumDeclaration() {
        String source = "enum! Color { Red };\nenum! Color { Blue };\n";

        List<Diagnostic> diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).getKind()).isEqualTo(DiagnosticKind.DUPLICATE_ENUM);
        assertThat(diagnostics.get(0).getLine()).isEqualTo(2);
    }

    @Test
    void testFlagEnumsAndPlainSwitchesAreIgnored() {
        String source = """
            enum_flags! Perm { Read = 1, Write = 2 };
            enum! Color { Red, Green };
            void f(Perm p, Color c) {
                CS_SWITCH_EXHAUSTIVE(Perm, p)
                    CS_CASE(Read); break;
                CS_SWITCH_END(Perm, p);
                switch (c) { case Red: break; default: break; }
            }
            """;

        assertThat(analyze(source)).isEmpty();
    }

    @Test
    void testNestedRegionsAreCheckedIndependently() {
        String source = """
            enum! Color { Red, Green };
            enum! Size { Small, Large };
            void f(Color c, Size s) {
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Red);
                        CS_SWITCH_EXHAUSTIVE(Size, s)
                            CS_CASE(Small); break;
                        CS_SWITCH_END(Size, s);
                        break;
                    CS_CASE(Green); break;
                CS_SWITCH_END(Color, c);
            }
            """;

        List<Diagnostic> diagnostics = analyze(source);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).getMessage()).isEqualTo("missing Large in switch over enum 'Size'");
        assertThat(diagnostics.get(0).getLine()).isEqualTo(6);
    }

    @Test
    void testVerifyReportsEveryProblemAtOnce() {
        String source = """
            enum! Color { Red, Green, Blue };
            void f(Color c) {
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Red); break;
                CS_SWITCH_END(Color, c);
                CS_SWITCH_EXHAUSTIVE(Color, c)
                    CS_CASE(Green); break;
                CS_SWITCH_END(Color, c);
            }
            """;
        LoweringResult lowered = engine.lower(source, Configuration.defaults());

        assertThatThrownBy(() -> analyzer.verify(lowered.getText(), lowered.getEnumDeclarations()))
                .isInstanceOf(TranslationException.class)
                .satisfies(e -> assertThat(((TranslationException) e).getDiagnostics())
                        .extracting(Diagnostic::getMessage)
                        .containsExactly(
                                "missing Green, Blue in switch over enum 'Color'",
                                "missing Red, Blue in switch over enum 'Color'"));
    }
}
