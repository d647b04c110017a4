package com.cscript.compiler.build.profile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.cscript.compiler.lexer.SourceLexer;
import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;

/**
 * Finds top-level function definitions and inserts profiling hooks or hot
 * attributes into them. Insertions never add newlines, so line numbers of
 * the annotated text match the input.
 */
public class FunctionAnnotator {

    static final String INTERNAL_PREFIX = "cs__";
    static final String HOT_MARKER = "CS_HOT ";

    /**
     * A definition is {@code name(...) {...}} at brace depth zero. Names with
     * the internal prefix are generated helpers and are skipped.
     */
    public List<FunctionDefinition> findDefinitions(String text) {
        List<SourceToken> tokens = SourceLexer.tokenize(text);
        List<FunctionDefinition> definitions = new ArrayList<>();

        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.isPunctuation("{")) {
                depth++;
                continue;
            }
            if (token.isPunctuation("}")) {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth != 0 || !token.is(TokenType.IDENTIFIER) || token.getText().startsWith(INTERNAL_PREFIX)) {
                continue;
            }

            int open = TokenScanner.nextSignificant(tokens, i + 1);
            if (!tokens.get(open).isPunctuation("(")) {
                continue;
            }
            int close = TokenScanner.findClosing(tokens, open);
            if (close < 0) {
                continue;
            }
            int body = TokenScanner.nextSignificant(tokens, close + 1);
            if (!tokens.get(body).isPunctuation("{")) {
                i = close;
                continue;
            }

            definitions.add(new FunctionDefinition(token.getText(), token.getLine(),
                    tokens.get(headerStart(tokens, i)).getOffset(), tokens.get(body).getOffset()));
            i = body - 1;
        }
        return definitions;
    }

    public boolean definesFunction(String text, String name) {
        return findDefinitions(text).stream().anyMatch(definition -> definition.getName().equals(name));
    }

    /**
     * Adds {@code cs_prof_hit("name");} at the entry of every definition.
     */
    public String instrument(String text) {
        TreeMap<Integer, String> insertions = new TreeMap<>();
        for (FunctionDefinition definition : findDefinitions(text)) {
            insertions.put(definition.getBodyOffset() + 1, " cs_prof_hit(\"" + definition.getName() + "\");");
        }
        return insert(text, insertions);
    }

    /**
     * Prefixes the definitions of {@code hotFunctions} with {@code CS_HOT}.
     */
    public String markHot(String text, Collection<String> hotFunctions) {
        Set<String> hot = Set.copyOf(hotFunctions);
        TreeMap<Integer, String> insertions = new TreeMap<>();
        for (FunctionDefinition definition : findDefinitions(text)) {
            if (hot.contains(definition.getName())) {
                insertions.put(definition.getHeaderOffset(), HOT_MARKER);
            }
        }
        return insert(text, insertions);
    }

    /**
     * Walks back from the function name over the return type and specifiers.
     */
    private static int headerStart(List<SourceToken> tokens, int nameIndex) {
        int start = nameIndex;
        int previous = TokenScanner.previousSignificant(tokens, nameIndex);
        while (previous >= 0) {
            SourceToken token = tokens.get(previous);
            if (!token.is(TokenType.IDENTIFIER) && !token.isPunctuation("*")) {
                break;
            }
            start = previous;
            previous = TokenScanner.previousSignificant(tokens, previous);
        }
        return start;
    }

    private static String insert(String text, TreeMap<Integer, String> insertions) {
        StringBuilder sb = new StringBuilder(text.length() + insertions.size() * 24);
        int last = 0;
        for (Map.Entry<Integer, String> entry : insertions.entrySet()) {
            sb.append(text, last, entry.getKey()).append(entry.getValue());
            last = entry.getKey();
        }
        sb.append(text.substring(last));
        return sb.toString();
    }
}
