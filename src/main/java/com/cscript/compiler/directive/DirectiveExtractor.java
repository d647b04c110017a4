package com.cscript.compiler.directive;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.exception.TranslationException;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.Configuration.ConfigurationBuilder;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.model.DiagnosticKind;
import com.cscript.compiler.model.OptLevel;
import com.cscript.compiler.model.ProfileMode;
import com.cscript.compiler.model.SourceUnit;

/**
 * Strips {@code @directive} lines from a unit and folds them into a {@link Configuration}.
 *
 * Format (one per line, anywhere in the unit):
 * - Switches: {@code @hardline off}, {@code @softline on}, {@code @lto off}, {@code @guardian}
 * - Levels: {@code @opt O3}, {@code @profile auto}
 * - Paths: {@code @out "bin/app"}, {@code @inc "include"}, {@code @libpath "/opt/lib"}
 * - Libraries and macros: {@code @link "m"}, {@code @define DEBUG=1}
 *
 * Unknown directives produce a warning and are ignored. A malformed value of a
 * known directive is fatal; every such problem in the unit is reported at once.
 * A line opening an {@code @unsafe { ... }} block is code, not a directive, and
 * is left for the lowering engine.
 */
public class DirectiveExtractor {
    private static final Logger log = LoggerFactory.getLogger(DirectiveExtractor.class);

    public static final char SIGIL = '@';

    static final String UNSAFE_BLOCK = "@unsafe";

    private static final Pattern MACRO_DEFINITION = Pattern.compile("[A-Za-z_]\\w*(=.*)?");

    private static final Map<String, BiConsumer<DirectiveLine, ConfigurationBuilder>> HANDLERS = Map.ofEntries(
        Map.entry("hardline", (d, b) -> b.hardline(switchValue(d))),
        Map.entry("softline", (d, b) -> b.softline(switchValue(d))),
        Map.entry("lto", (d, b) -> b.lto(switchValue(d))),
        Map.entry("guardian", (d, b) -> b.guardian(switchValue(d))),
        Map.entry("anim", (d, b) -> b.anim(switchValue(d))),
        Map.entry("muttrack", (d, b) -> b.muttrack(switchValue(d))),
        Map.entry("debug", (d, b) -> b.debug(switchValue(d))),
        Map.entry("opt", (d, b) -> b.opt(OptLevel.fromDirective(singleArgument(d))
                .orElseThrow(() -> invalid(d, "expected one of O0, O1, O2, O3, max, size")))),
        Map.entry("profile", (d, b) -> b.profile(ProfileMode.fromDirective(singleArgument(d))
                .orElseThrow(() -> invalid(d, "expected one of on, off, auto")))),
        Map.entry("out", (d, b) -> b.out(nonEmpty(d))),
        Map.entry("abi", (d, b) -> b.abi(singleArgument(d))),
        Map.entry("define", (d, b) -> b.define(macroDefinition(d))),
        Map.entry("inc", (d, b) -> b.includePath(nonEmpty(d))),
        Map.entry("libpath", (d, b) -> b.libraryPath(nonEmpty(d))),
        Map.entry("link", (d, b) -> b.link(nonEmpty(d)))
    );

    public ExtractionResult extract(String unitName, String text) {
        return extract(unitName, text, Configuration.defaults());
    }

    /**
     * Extracts directives on top of {@code base}, typically built from command-line options.
     *
     * @throws TranslationException if any recognized directive carries a malformed value
     */
    public ExtractionResult extract(String unitName, String text, Configuration base) {
        ConfigurationBuilder builder = base.toBuilder();
        List<Diagnostic> warnings = new ArrayList<>();
        List<Diagnostic> errors = new ArrayList<>();

        String[] lines = text.split("\n", -1);
        StringBuilder residual = new StringBuilder(text.length());

        for (int i = 0; i < lines.length; i++) {
            String lineContent = lines[i];
            int lineNum = i + 1;
            String trimmed = lineContent.strip();

            if (!trimmed.isEmpty() && trimmed.charAt(0) == SIGIL && !opensUnsafeBlock(trimmed)) {
                applyDirective(trimmed.substring(1), lineNum, builder, warnings, errors);
                // Keep the line, drop its content, so later line numbers do not move.
                if (lineContent.endsWith("\r")) {
                    residual.append('\r');
                }
            } else {
                residual.append(lineContent);
            }

            if (i < lines.length - 1) {
                residual.append('\n');
            }
        }

        if (!errors.isEmpty()) {
            throw new TranslationException(errors);
        }

        Configuration configuration = builder.build();
        log.debug("Extracted configuration for {}: {}", unitName, configuration);
        return new ExtractionResult(new SourceUnit(unitName, text, residual.toString()), configuration, warnings);
    }

    private void applyDirective(String body, int lineNum, ConfigurationBuilder builder,
                                List<Diagnostic> warnings, List<Diagnostic> errors) {
        DirectiveLine directive;
        try {
            directive = DirectiveLine.parse(body, lineNum);
        } catch (IllegalArgumentException e) {
            String name = body.split("\\s+", 2)[0];
            if (HANDLERS.containsKey(name)) {
                errors.add(Diagnostic.error(lineNum, DiagnosticKind.MALFORMED_DIRECTIVE,
                        "@" + name + ": " + e.getMessage()));
            } else {
                warnUnknown(name, lineNum, warnings);
            }
            return;
        }

        BiConsumer<DirectiveLine, ConfigurationBuilder> handler = HANDLERS.get(directive.getName());
        if (handler == null) {
            warnUnknown(directive.getName(), lineNum, warnings);
            return;
        }

        try {
            handler.accept(directive, builder);
            log.debug("Applied directive @{} {} at line {}", directive.getName(), directive.getArguments(), lineNum);
        } catch (IllegalArgumentException e) {
            errors.add(Diagnostic.error(lineNum, DiagnosticKind.MALFORMED_DIRECTIVE, e.getMessage()));
            log.debug("Malformed directive at line {}: {}", lineNum, e.getMessage());
        }
    }

    private static boolean opensUnsafeBlock(String trimmed) {
        if (!trimmed.startsWith(UNSAFE_BLOCK)) {
            return false;
        }
        String rest = trimmed.substring(UNSAFE_BLOCK.length()).strip();
        return rest.isEmpty() || rest.charAt(0) == '{';
    }

    private void warnUnknown(String name, int lineNum, List<Diagnostic> warnings) {
        warnings.add(Diagnostic.warning(lineNum, DiagnosticKind.UNKNOWN_DIRECTIVE,
                "unknown directive @" + name + " ignored"));
        log.warn("Unknown directive @{} at line {} ignored", name, lineNum);
    }

    private static boolean switchValue(DirectiveLine d) {
        if (d.getArguments().isEmpty()) {
            return true;
        }
        switch (singleArgument(d)) {
            case "on":
                return true;
            case "off":
                return false;
            default:
                throw invalid(d, "expected on or off");
        }
    }

    private static String singleArgument(DirectiveLine d) {
        if (d.getArguments().size() != 1) {
            throw new IllegalArgumentException("@" + d.getName() + " takes exactly one argument, got "
                    + d.getArguments().size());
        }
        return d.getArguments().get(0);
    }

    private static String nonEmpty(DirectiveLine d) {
        String value = singleArgument(d);
        if (value.isEmpty()) {
            throw invalid(d, "value must not be empty");
        }
        return value;
    }

    private static String macroDefinition(DirectiveLine d) {
        String value = singleArgument(d);
        if (!MACRO_DEFINITION.matcher(value).matches()) {
            throw invalid(d, "expected NAME or NAME=VALUE");
        }
        return value;
    }

    private static IllegalArgumentException invalid(DirectiveLine d, String expectation) {
        return new IllegalArgumentException("@" + d.getName() + " " + String.join(" ", d.getArguments())
                + ": " + expectation);
    }
}
