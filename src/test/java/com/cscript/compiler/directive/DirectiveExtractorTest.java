package com.cscript.compiler.directive;

import com.cscript.compiler.exception.TranslationException;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.DiagnosticKind;
import com.cscript.compiler.model.OptLevel;
import com.cscript.compiler.model.ProfileMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DirectiveExtractor.
 */
class DirectiveExtractorTest {

    private final DirectiveExtractor extractor = new DirectiveExtractor();

    @Test
    void testDefaultsWithoutDirectives() {
        ExtractionResult result = extractor.extract("unit.csc", "int main(void) { return 0; }\n");

        Configuration config = result.getConfiguration();
        assertThat(config.isHardline()).isTrue();
        assertThat(config.isSoftline()).isTrue();
        assertThat(config.getOpt()).isEqualTo(OptLevel.O2);
        assertThat(config.isLto()).isTrue();
        assertThat(config.getProfile()).isEqualTo(ProfileMode.OFF);
        assertThat(config.getOut()).isEqualTo("a.out");
        assertThat(config.isGuardian()).isFalse();
        assertThat(config.isMuttrack()).isFalse();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testLaterScalarDirectiveWins() {
        ExtractionResult result = extractor.extract("unit.csc", "@opt O2\n@opt max\n");

        assertThat(result.getConfiguration().getOpt()).isEqualTo(OptLevel.MAX);
    }

    @Test
    void testDirectiveLinesAreBlankedAndLineCountKept() {
        String source = "@hardline off\nint x;\n  @lto off // no lto\nint y;";

        ExtractionResult result = extractor.extract("unit.csc", source);

        assertThat(result.getUnit().getResidualText()).isEqualTo("\nint x;\n\nint y;");
        assertThat(result.getUnit().getOriginalText()).isEqualTo(source);
        assertThat(result.getConfiguration().isHardline()).isFalse();
        assertThat(result.getConfiguration().isLto()).isFalse();
    }

    @Test
    void testListDirectivesAccumulateInOrder() {
        String source = """
            @define DEBUG
            @define LEVEL=3
            @inc "include"
            @inc "third party/include"
            @libpath "/opt/lib"
            @link "m"
            @link "pthread"
            """;

        Configuration config = extractor.extract("unit.csc", source).getConfiguration();

        assertThat(config.getDefines()).containsExactly("DEBUG", "LEVEL=3");
        assertThat(config.getIncludePaths()).containsExactly("include", "third party/include");
        assertThat(config.getLibraryPaths()).containsExactly("/opt/lib");
        assertThat(config.getLinks()).containsExactly("m", "pthread");
    }

    @Test
    void testBareSwitchMeansOn() {
        Configuration config = extractor.extract("unit.csc", "@guardian\n@muttrack\n@anim\n@debug\n")
                .getConfiguration();

        assertThat(config.isGuardian()).isTrue();
        assertThat(config.isMuttrack()).isTrue();
        assertThat(config.isAnim()).isTrue();
        assertThat(config.isDebug()).isTrue();
    }

    @Test
    void testQuotedArgumentsSupportEscapes() {
        Configuration config = extractor.extract("unit.csc", "@out \"bin/my app\"\n@abi \"sysv \\\"x86\\\"\"\n")
                .getConfiguration();

        assertThat(config.getOut()).isEqualTo("bin/my app");
        assertThat(config.getAbi()).isEqualTo("sysv \"x86\"");
    }

    @Test
    void testUnknownDirectiveIsAWarning() {
        ExtractionResult result = extractor.extract("unit.csc", "@turbo on\nint x;\n");

        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0).getKind()).isEqualTo(DiagnosticKind.UNKNOWN_DIRECTIVE);
        assertThat(result.getWarnings().get(0).getLine()).isEqualTo(1);
        assertThat(result.getWarnings().get(0).isError()).isFalse();
    }

    @Test
    void testAllMalformedDirectivesAreReportedTogether() {
        String source = "@opt fast\nint x;\n@lto maybe\n@define 1BAD\n@profile\n";

        assertThatThrownBy(() -> extractor.extract("unit.csc", source))
                .isInstanceOf(TranslationException.class)
                .satisfies(e -> {
                    TranslationException te = (TranslationException) e;
                    assertThat(te.getDiagnostics()).hasSize(4);
                    assertThat(te.getDiagnostics())
                            .allMatch(d -> d.getKind() == DiagnosticKind.MALFORMED_DIRECTIVE);
                    assertThat(te.getDiagnostics()).extracting(d -> d.getLine()).containsExactly(1, 3, 4, 5);
                });
    }

    @Test
    void testBaseConfigurationIsOverriddenByDirectives() {
        Configuration base = Configuration.builder().out("cli.out").opt(OptLevel.O0).build();

        Configuration config = extractor.extract("unit.csc", "@opt O3\n", base).getConfiguration();

        assertThat(config.getOpt()).isEqualTo(OptLevel.O3);
        assertThat(config.getOut()).isEqualTo("cli.out");
    }

    @Test
    void testDoubleSlashInsideArgumentIsNotAComment() {
        String source = "@define URL=http://example.com\n@opt O3 // fast build\n@out \"a//b\" // quoted\n";

        ExtractionResult result = extractor.extract("unit.csc", source);

        assertThat(result.getConfiguration().getDefines()).containsExactly("URL=http://example.com");
        assertThat(result.getConfiguration().getOpt()).isEqualTo(OptLevel.O3);
        assertThat(result.getConfiguration().getOut()).isEqualTo("a//b");
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testUnsafeBlockLineIsCodeNotDirective() {
        String source = "void f(void) {\n    @unsafe {\n        g();\n    }\n    @unsafe\n    { g(); }\n}\n";

        ExtractionResult result = extractor.extract("unit.csc", source);

        assertThat(result.getUnit().getResidualText()).isEqualTo(source);
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testUnsafeLookalikeIsStillADirective() {
        ExtractionResult result = extractor.extract("unit.csc", "@unsafety on\nint x;\n");

        assertThat(result.getUnit().getResidualText()).isEqualTo("\nint x;\n");
        assertThat(result.getWarnings()).singleElement()
                .satisfies(w -> assertThat(w.getKind()).isEqualTo(DiagnosticKind.UNKNOWN_DIRECTIVE));
    }
}
