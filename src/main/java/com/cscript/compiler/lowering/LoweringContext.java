package com.cscript.compiler.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cscript.compiler.model.EnumDeclaration;

/**
 * Mutable state owned by one lowering run: collected enum declarations, the
 * counter used to name cached match values and per-rule rewrite counts.
 * Never shared between units.
 */
public class LoweringContext {

    private final List<EnumDeclaration> enumDeclarations = new ArrayList<>();
    private final Map<String, Integer> rewriteCounts = new LinkedHashMap<>();
    private int matchCounter = 0;

    public void addEnumDeclaration(EnumDeclaration declaration) {
        enumDeclarations.add(declaration);
    }

    public List<EnumDeclaration> getEnumDeclarations() {
        return List.copyOf(enumDeclarations);
    }

    public int nextMatchId() {
        return matchCounter++;
    }

    public void recordRewrite(String ruleName) {
        rewriteCounts.merge(ruleName, 1, Integer::sum);
    }

    public Map<String, Integer> getRewriteCounts() {
        return Map.copyOf(rewriteCounts);
    }
}
