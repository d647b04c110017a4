package com.cscript.compiler.lowering;

import java.util.List;
import java.util.Map;

import com.cscript.compiler.model.EnumDeclaration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Lowered text plus what the rules learned while producing it.
 */
@Value
@Builder
public class LoweringResult {

    String text;

    @Singular
    List<EnumDeclaration> enumDeclarations;

    @Singular
    Map<String, Integer> rewriteCounts;

    public int totalRewrites() {
        return rewriteCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
