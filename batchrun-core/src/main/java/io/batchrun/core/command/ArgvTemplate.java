package io.batchrun.core.command;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Renders a command's parameter template into argv tokens.
///
/// The template is first split like a POSIX shell would split it: whitespace
/// separates tokens, single quotes keep their content literally, double quotes
/// keep whitespace but honour backslash escapes of `\`, `"`, `$` and backtick,
/// and a backslash outside quotes escapes the next character. Each token is then
/// formatted by replacing `{name}` with the string form of the argument `name`;
/// `{{` and `}}` produce literal braces.
///
/// {@snippet :
/// ArgvTemplate.render("--rent-id {rent_id} --label 'two words'", Map.of("rent_id", 123));
/// // ["--rent-id", "123", "--label", "two words"]
/// }
public final class ArgvTemplate {

    private ArgvTemplate() {}

    /// Splits and formats a template.
    ///
    /// @param template the parameter template, not null, may be empty
    /// @param arguments values to substitute, not null
    /// @return the rendered tokens, never null
    /// @throws BatchrunException with {@link ErrorCode#INVALID_ARGUMENTS} if the template is
    ///     malformed or references a missing argument
    public static List<String> render(String template, Map<String, ?> arguments) {
        Objects.requireNonNull(arguments, "arguments must not be null");
        List<String> rendered = new ArrayList<>();
        for (String token : split(template)) {
            rendered.add(format(token, arguments));
        }
        return rendered;
    }

    /// Splits a template into tokens with POSIX shell quoting rules.
    ///
    /// @param template the text to split, not null
    /// @return the tokens, never null
    /// @throws BatchrunException with {@link ErrorCode#INVALID_ARGUMENTS} on an unclosed quote
    ///     or a trailing backslash
    public static List<String> split(String template) {
        Objects.requireNonNull(template, "template must not be null");
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int n = template.length();
        while (i < n) {
            char c = template.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int close = template.indexOf('\'', i + 1);
                if (close < 0) {
                    throw invalid("No closing quotation in: " + template);
                }
                current.append(template, i + 1, close);
                inToken = true;
                i = close + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(template, i + 1, current);
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= n) {
                    throw invalid("No escaped character in: " + template);
                }
                current.append(template.charAt(i + 1));
                inToken = true;
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static int readDoubleQuoted(String template, int start, StringBuilder out) {
        int i = start;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\'
                    && i + 1 < template.length()
                    && "\\\"$`".indexOf(template.charAt(i + 1)) >= 0) {
                out.append(template.charAt(i + 1));
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        throw invalid("No closing quotation in: " + template);
    }

    /// Replaces `{name}` placeholders in a single token.
    static String format(String token, Map<String, ?> arguments) {
        StringBuilder out = new StringBuilder(token.length());
        int i = 0;
        while (i < token.length()) {
            char c = token.charAt(i);
            if (c == '{') {
                if (i + 1 < token.length() && token.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = token.indexOf('}', i + 1);
                if (close < 0) {
                    throw invalid("Unmatched '{' in: " + token);
                }
                String name = token.substring(i + 1, close);
                if (name.isEmpty() || !arguments.containsKey(name)) {
                    throw invalid("Missing argument for placeholder {" + name + "}");
                }
                out.append(String.valueOf(arguments.get(name)));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < token.length() && token.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw invalid("Single '}' in: " + token);
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static BatchrunException invalid(String message) {
        return new BatchrunException(ErrorCode.INVALID_ARGUMENTS, message);
    }
}
