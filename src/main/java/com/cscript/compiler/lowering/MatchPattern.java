package com.cscript.compiler.lowering;

import java.util.ArrayList;
import java.util.List;

import com.cscript.compiler.lexer.SourceLexer;
import com.cscript.compiler.lexer.SourceToken;
import com.cscript.compiler.lexer.SourceToken.TokenType;
import com.cscript.compiler.lexer.TokenScanner;

import lombok.Getter;

/**
 * The left-hand side of one match arm.
 */
@Getter
class MatchPattern {

    enum Kind {
        WILDCARD,
        SCALAR,
        TUPLE
    }

    /**
     * How a tuple pattern treats one field.
     */
    enum FieldKind {
        BIND,
        IGNORE,
        TEST
    }

    static final int MAX_TUPLE_FIELDS = 3;

    private final Kind kind;
    private final List<String> alternatives;
    private final List<FieldKind> fieldKinds;

    private MatchPattern(Kind kind, List<String> alternatives, List<FieldKind> fieldKinds) {
        this.kind = kind;
        this.alternatives = alternatives;
        this.fieldKinds = fieldKinds;
    }

    /**
     * Parses the tokens in {@code [from, to)}. Returns null when the span is
     * empty or is a tuple of an unsupported arity.
     */
    static MatchPattern parse(List<SourceToken> tokens, int from, int to) {
        int first = TokenScanner.nextSignificant(tokens, from);
        if (first >= to) {
            return null;
        }
        int last = TokenScanner.previousSignificant(tokens, to);

        SourceToken head = tokens.get(first);
        if (first == last && (head.isIdentifier("_") || head.isIdentifier("default"))) {
            return new MatchPattern(Kind.WILDCARD, List.of(), List.of());
        }

        if (head.isPunctuation("(") && TokenScanner.findClosing(tokens, first) == last) {
            List<String> fields = split(tokens, first + 1, last, ",");
            if (fields != null && fields.size() >= 2) {
                if (fields.size() > MAX_TUPLE_FIELDS) {
                    return null;
                }
                List<FieldKind> kinds = new ArrayList<>();
                for (String field : fields) {
                    kinds.add(classify(field));
                }
                return new MatchPattern(Kind.TUPLE, fields, kinds);
            }
        }

        List<String> alternatives = split(tokens, first, last + 1, "|");
        if (alternatives == null) {
            return null;
        }
        return new MatchPattern(Kind.SCALAR, alternatives, List.of());
    }

    boolean isWildcard() {
        return kind == Kind.WILDCARD;
    }

    /**
     * The C condition selecting this arm, given the name of the cached scrutinee.
     */
    String condition(String cached) {
        List<String> terms = new ArrayList<>();
        if (kind == Kind.SCALAR) {
            for (String alternative : alternatives) {
                terms.add(cached + " == (" + alternative + ")");
            }
            return String.join(" || ", terms);
        }
        for (int i = 0; i < fieldKinds.size(); i++) {
            if (fieldKinds.get(i) == FieldKind.TEST) {
                terms.add(cached + "._" + i + " == (" + alternatives.get(i) + ")");
            }
        }
        return terms.isEmpty() ? "1" : String.join(" && ", terms);
    }

    /**
     * Declarations introduced by tuple bindings, each followed by a void cast
     * so unused bindings stay warning-free.
     */
    String bindings(String cached) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fieldKinds.size(); i++) {
            if (fieldKinds.get(i) == FieldKind.BIND) {
                String name = alternatives.get(i);
                sb.append("__typeof__(").append(cached).append("._").append(i).append(") ")
                        .append(name).append(" = ").append(cached).append("._").append(i).append("; (void)")
                        .append(name).append("; ");
            }
        }
        return sb.toString();
    }

    private static FieldKind classify(String field) {
        if (field.equals("_")) {
            return FieldKind.IGNORE;
        }
        List<SourceToken> tokens = SourceLexer.tokenize(field);
        if (tokens.size() == 2 && tokens.get(0).is(TokenType.IDENTIFIER)) {
            return FieldKind.BIND;
        }
        return FieldKind.TEST;
    }

    /**
     * Splits {@code [from, to)} at top-level occurrences of {@code separator};
     * returns null when any piece is empty.
     */
    private static List<String> split(List<SourceToken> tokens, int from, int to, String separator) {
        List<String> pieces = new ArrayList<>();
        int start = from;
        while (true) {
            int at = TokenScanner.findAtDepthZero(tokens, start, to, separator);
            int end = at < 0 ? to : at;
            String piece = TokenScanner.text(tokens, start, end).strip();
            if (piece.isEmpty()) {
                return null;
            }
            pieces.add(piece);
            if (at < 0) {
                return pieces;
            }
            start = at + 1;
        }
    }
}
