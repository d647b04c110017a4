package com.cscript.compiler.directive;

import java.util.ArrayList;
import java.util.List;

import lombok.Value;

/**
 * A single {@code @name arg...} line split into its name and arguments.
 *
 * Arguments are separated by blanks; double quotes group an argument and
 * support {@code \"} and {@code \\} escapes. A {@code //} at the start of
 * an argument begins a trailing comment; inside an argument, as in
 * {@code URL=http://host}, it is ordinary text.
 */
@Value
public class DirectiveLine {
    String name;
    List<String> arguments;
    int line;

    /**
     * Parses the text following the sigil.
     *
     * @throws IllegalArgumentException when a quoted argument is not terminated
     */
    public static DirectiveLine parse(String body, int line) {
        int pos = 0;
        while (pos < body.length() && !Character.isWhitespace(body.charAt(pos))) {
            pos++;
        }
        String name = body.substring(0, pos);
        List<String> arguments = splitArguments(body.substring(pos));
        return new DirectiveLine(name, arguments, line);
    }

    private static List<String> splitArguments(String raw) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = null;
        boolean quoted = false;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);

            if (quoted) {
                if (c == '\\' && i + 1 < raw.length()
                        && (raw.charAt(i + 1) == '"' || raw.charAt(i + 1) == '\\')) {
                    current.append(raw.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
                continue;
            }

            if (Character.isWhitespace(c)) {
                if (current != null) {
                    arguments.add(current.toString());
                    current = null;
                }
            } else if (current == null && c == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '/') {
                break;
            } else if (c == '"') {
                if (current == null) {
                    current = new StringBuilder();
                }
                quoted = true;
            } else {
                if (current == null) {
                    current = new StringBuilder();
                }
                current.append(c);
            }
        }

        if (quoted) {
            throw new IllegalArgumentException("unterminated quoted argument");
        }
        if (current != null) {
            arguments.add(current.toString());
        }
        return arguments;
    }
}
