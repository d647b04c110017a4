package com.cscript.compiler.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cscript.compiler.exception.TranslationException;
import com.cscript.compiler.model.CaseLabel;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.model.DiagnosticKind;
import com.cscript.compiler.model.EnumDeclaration;
import com.cscript.compiler.model.ExhaustivenessRegion;

/**
 * Checks every exhaustive switch region against the variants of its enum.
 * All regions are examined before anything is reported.
 */
public class ExhaustivenessAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ExhaustivenessAnalyzer.class);

    private final RegionScanner scanner;

    public ExhaustivenessAnalyzer() {
        this(new RegionScanner());
    }

    public ExhaustivenessAnalyzer(RegionScanner scanner) {
        this.scanner = scanner;
    }

    public List<Diagnostic> analyze(String loweredText, List<EnumDeclaration> declarations) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, EnumDeclaration> enums = indexDeclarations(declarations, diagnostics);

        List<ExhaustivenessRegion> regions = scanner.scan(loweredText);
        for (ExhaustivenessRegion region : regions) {
            checkRegion(region, enums, diagnostics);
        }

        log.debug("Checked {} exhaustive regions against {} enums, {} problems",
                regions.size(), enums.size(), diagnostics.size());
        return diagnostics;
    }

    /**
     * Same as {@link #analyze} but throws when any error was found.
     */
    public void verify(String loweredText, List<EnumDeclaration> declarations) {
        List<Diagnostic> diagnostics = analyze(loweredText, declarations);
        if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
            throw new TranslationException(diagnostics);
        }
    }

    private Map<String, EnumDeclaration> indexDeclarations(List<EnumDeclaration> declarations,
                                                           List<Diagnostic> diagnostics) {
        Map<String, EnumDeclaration> enums = new LinkedHashMap<>();
        for (EnumDeclaration declaration : declarations) {
            EnumDeclaration first = enums.putIfAbsent(declaration.getName(), declaration);
            if (first != null) {
                diagnostics.add(Diagnostic.error(declaration.getLine(), DiagnosticKind.DUPLICATE_ENUM,
                        "enum '" + declaration.getName() + "' is already declared at line " + first.getLine()));
            }
        }
        return enums;
    }

    private void checkRegion(ExhaustivenessRegion region, Map<String, EnumDeclaration> enums,
                             List<Diagnostic> diagnostics) {
        String enumName = region.getEnumName();
        if (!region.isTerminated()) {
            diagnostics.add(Diagnostic.error(region.getLine(), DiagnosticKind.UNTERMINATED_REGION,
                    "switch over '" + enumName + "' has no matching CS_SWITCH_END"));
            return;
        }

        EnumDeclaration declaration = enums.get(enumName);
        if (declaration == null) {
            diagnostics.add(Diagnostic.error(region.getLine(), DiagnosticKind.UNKNOWN_ENUM,
                    "switch over undeclared enum '" + enumName + "'"));
            return;
        }
        if (declaration.isFlags()) {
            log.debug("Skipping switch over flag enum '{}' at line {}", enumName, region.getLine());
            return;
        }

        for (CaseLabel label : region.getLabels()) {
            if (!declaration.hasVariant(label.getName())) {
                diagnostics.add(Diagnostic.error(label.getLine(), DiagnosticKind.FOREIGN_VARIANT,
                        "'" + label.getName() + "' is not a variant of enum '" + enumName + "'"));
            }
        }

        Set<String> covered = region.covered();
        List<String> missing = declaration.variantNames().stream()
                .filter(variant -> !covered.contains(variant))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            diagnostics.add(Diagnostic.error(region.getLine(), DiagnosticKind.NON_EXHAUSTIVE,
                    "missing " + String.join(", ", missing) + " in switch over enum '" + enumName + "'"));
        }
    }
}
