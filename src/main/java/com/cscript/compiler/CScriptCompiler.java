package com.cscript.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.analysis.ExhaustivenessAnalyzer;
import com.cscript.compiler.build.BuildOrchestrator;
import com.cscript.compiler.build.BuildOutcome;
import com.cscript.compiler.build.OrchestratorSettings;
import com.cscript.compiler.build.toolchain.ProgramRunner;
import com.cscript.compiler.build.toolchain.Toolchain;
import com.cscript.compiler.directive.DirectiveExtractor;
import com.cscript.compiler.directive.ExtractionResult;
import com.cscript.compiler.exception.TranslationException;
import com.cscript.compiler.lowering.LoweringEngine;
import com.cscript.compiler.lowering.LoweringResult;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.prelude.PreludeComposer;

/**
 * Runs the whole pipeline for one unit: directives, lowering, exhaustiveness
 * checking and the build. Instances hold no per-unit state and may compile
 * several units concurrently.
 */
public class CScriptCompiler {
    private static final Logger log = LoggerFactory.getLogger(CScriptCompiler.class);

    private final DirectiveExtractor extractor;
    private final LoweringEngine loweringEngine;
    private final ExhaustivenessAnalyzer analyzer;
    private final PreludeComposer preludeComposer;
    private final BuildOrchestrator orchestrator;
    private final boolean strict;

    public CScriptCompiler(Toolchain toolchain, ProgramRunner runner, OrchestratorSettings settings) {
        this(toolchain, runner, settings, false);
    }

    /**
     * @param strict keep hardline on even when a unit turns it off with a directive
     */
    public CScriptCompiler(Toolchain toolchain, ProgramRunner runner, OrchestratorSettings settings,
                           boolean strict) {
        this.strict = strict;
        this.extractor = new DirectiveExtractor();
        this.loweringEngine = new LoweringEngine();
        this.analyzer = new ExhaustivenessAnalyzer();
        this.preludeComposer = new PreludeComposer();
        this.orchestrator = new BuildOrchestrator(toolchain, runner, settings, preludeComposer);
    }

    /**
     * Reads the unit as ISO-8859-1: every byte maps to one char and back, so
     * text the lowering leaves alone reaches the C compiler byte for byte
     * whatever the source encoding.
     */
    public CompilationResult compileFile(Path source, Configuration base) throws IOException {
        String text = readUnit(source);
        return compile(source.getFileName().toString(), text, base);
    }

    public CompilationResult compile(String unitName, String text, Configuration base) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Translation translation;
        try {
            translation = translateUnit(unitName, text, base, diagnostics);
        } catch (TranslationException e) {
            diagnostics.addAll(e.getDiagnostics());
            return CompilationResult.failure(unitName, diagnostics);
        }

        Configuration configuration = translation.configuration;
        progress(configuration, "Building {} (opt {}, profile {})", unitName, configuration.getOpt(),
                configuration.getProfile());
        BuildOutcome outcome = orchestrator.build(unitName, translation.loweredText, configuration);
        diagnostics.addAll(outcome.getDiagnostics());

        return CompilationResult.builder()
                .success(outcome.isSuccess())
                .unitName(unitName)
                .configuration(configuration)
                .diagnostics(diagnostics)
                .buildOutcome(outcome)
                .build();
    }

    /**
     * The complete C text the toolchain would receive for a plain build.
     *
     * @throws TranslationException if directives are malformed or a region is not exhaustive
     */
    public String translate(String unitName, String text, Configuration base) {
        Translation translation = translateUnit(unitName, text, base, new ArrayList<>());
        return preludeComposer.composeUnit(translation.configuration, unitName, translation.loweredText);
    }

    public static String readUnit(Path source) throws IOException {
        return Files.readString(source, StandardCharsets.ISO_8859_1);
    }

    private Translation translateUnit(String unitName, String text, Configuration base,
                                      List<Diagnostic> diagnostics) {
        ExtractionResult extraction = extractor.extract(unitName, text, base);
        diagnostics.addAll(extraction.getWarnings());
        Configuration configuration = extraction.getConfiguration();
        if (strict && !configuration.isHardline()) {
            log.debug("Strict mode overrides @hardline off in {}", unitName);
            configuration = configuration.toBuilder().hardline(true).build();
        }

        progress(configuration, "Lowering {}", unitName);
        LoweringResult lowering = loweringEngine.lower(extraction.getUnit().getResidualText(), configuration);

        progress(configuration, "Checking exhaustive switches in {}", unitName);
        analyzer.verify(lowering.getText(), lowering.getEnumDeclarations());
        return new Translation(configuration, lowering.getText());
    }

    /**
     * Phase progress is shown at INFO only when the unit asks for it with {@code @anim}.
     */
    private static void progress(Configuration configuration, String format, Object... args) {
        if (configuration.isAnim()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static class Translation {
        private final Configuration configuration;
        private final String loweredText;

        Translation(Configuration configuration, String loweredText) {
            this.configuration = configuration;
            this.loweredText = loweredText;
        }
    }
}
