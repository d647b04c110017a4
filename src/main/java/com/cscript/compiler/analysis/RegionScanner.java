package com.cscript.compiler.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.cscript.compiler.lexer.SourceLexer;
import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.TokenScanner;
import com.cscript.compiler.model.CaseLabel;
import com.cscript.compiler.model.ExhaustivenessRegion;

/**
 * Finds exhaustive switch regions in lowered text. Regions may nest; a
 * {@code CS_CASE} belongs to the innermost open region and an end marker
 * closes it. Markers inside comments, literals or preprocessor lines are
 * ignored.
 */
public class RegionScanner {

    static final String BEGIN_MARKER = "CS_SWITCH_EXHAUSTIVE";
    static final String CASE_MARKER = "CS_CASE";
    static final String END_MARKER = "CS_SWITCH_END";

    public List<ExhaustivenessRegion> scan(String text) {
        List<SourceToken> tokens = SourceLexer.tokenize(text);
        List<ExhaustivenessRegion.ExhaustivenessRegionBuilder> found = new ArrayList<>();
        Deque<ExhaustivenessRegion.ExhaustivenessRegionBuilder> open = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.isIdentifier(BEGIN_MARKER)) {
                String enumName = firstArgument(tokens, i);
                if (enumName != null) {
                    ExhaustivenessRegion.ExhaustivenessRegionBuilder region = ExhaustivenessRegion.builder()
                            .line(token.getLine())
                            .enumName(enumName)
                            .terminated(false);
                    found.add(region);
                    open.push(region);
                }
            } else if (token.isIdentifier(CASE_MARKER) && !open.isEmpty()) {
                String label = firstArgument(tokens, i);
                if (label != null) {
                    open.peek().label(new CaseLabel(label, token.getLine()));
                }
            } else if (token.isIdentifier(END_MARKER) && !open.isEmpty()) {
                if (firstArgument(tokens, i) != null) {
                    open.pop().terminated(true);
                }
            }
        }

        List<ExhaustivenessRegion> regions = new ArrayList<>(found.size());
        found.forEach(builder -> regions.add(builder.build()));
        return regions;
    }

    /**
     * Text of the first argument of the macro call starting at {@code nameIndex},
     * or null when the name is not followed by an argument list.
     */
    private static String firstArgument(List<SourceToken> tokens, int nameIndex) {
        int open = TokenScanner.nextSignificant(tokens, nameIndex + 1);
        if (!tokens.get(open).isPunctuation("(")) {
            return null;
        }
        int close = TokenScanner.findClosing(tokens, open);
        if (close < 0) {
            return null;
        }
        int comma = TokenScanner.findAtDepthZero(tokens, open + 1, close, ",");
        String argument = TokenScanner.text(tokens, open + 1, comma < 0 ? close : comma).strip();
        return argument.isEmpty() ? null : argument;
    }
}
