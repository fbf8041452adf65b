package domain.header;

import domain.error.HeaderParseException;
import domain.model.DataTest;
import domain.model.Relation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the {@code tests:} header value, e.g.
 * {@code not_null(id), unique(a, b), accepted_values(status, ['a', 'b']), relationships(user_id, app.users.id)}.
 *
 * <p>Commas inside {@code [...]} never split arguments. String lists accept {@code '} or {@code "}
 * quotes with doubled-quote escaping ({@code 'it''s'} -> {@code it's}).</p>
 */
public final class TestSpecParser {

    private static final String VALID_TYPES = "not_null, unique, accepted_values, relationships";

    private TestSpecParser() {
    }

    public static List<DataTest> parse(String raw) {
        String s = raw == null ? "" : raw.trim();
        List<DataTest> out = new ArrayList<>();
        int i = 0;
        int n = s.length();

        while (i < n) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
                continue;
            }

            int open = s.indexOf('(', i);
            if (open < 0) {
                throw new HeaderParseException("invalid test syntax (expected 'test_name(args)'): " + s.substring(i));
            }
            String name = s.substring(i, open).trim().toLowerCase(Locale.ROOT);

            int close = matchingClose(s, open + 1);
            if (close < 0) {
                throw new HeaderParseException("invalid test syntax (missing closing paren): " + s);
            }

            List<String> args = splitArgs(s.substring(open + 1, close));
            out.add(build(name, args));
            i = close + 1;
        }
        return out;
    }

    private static int matchingClose(String s, int from) {
        int depth = 1;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    static List<String> splitArgs(String s) {
        List<String> args = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addArg(args, cur);
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }
        if (depth != 0) {
            throw new HeaderParseException("unbalanced brackets in test arguments: " + s);
        }
        addArg(args, cur);
        return args;
    }

    private static void addArg(List<String> args, StringBuilder cur) {
        String t = cur.toString().trim();
        if (!t.isEmpty()) args.add(t);
    }

    private static DataTest build(String name, List<String> args) {
        if (args.isEmpty()) {
            throw new HeaderParseException("test '" + name + "' requires at least one argument");
        }
        return switch (name) {
            case "not_null" -> {
                if (args.size() != 1) {
                    throw new HeaderParseException("not_null() takes exactly one column, got " + args.size());
                }
                yield DataTest.notNull(args.get(0));
            }
            case "unique" -> DataTest.unique(args);
            case "accepted_values" -> {
                if (args.size() != 2) {
                    throw new HeaderParseException(
                            "accepted_values() takes column and list, e.g., accepted_values(status, ['a', 'b'])");
                }
                yield DataTest.acceptedValues(args.get(0), parseStringList(args.get(1)));
            }
            case "relationships" -> {
                if (args.size() != 2) {
                    throw new HeaderParseException(
                            "relationships() takes column and reference, e.g., relationships(user_id, app.users.id)");
                }
                String[] ref = args.get(1).trim().split("\\.", -1);
                if (ref.length != 3 || ref[0].isEmpty() || ref[1].isEmpty() || ref[2].isEmpty()) {
                    throw new HeaderParseException("relationships() second argument must be schema.table.column"
                            + " (e.g., 'app.users.id'), got: " + args.get(1).trim());
                }
                yield DataTest.relationships(args.get(0), Relation.of(ref[0], ref[1]), ref[2]);
            }
            default -> throw new HeaderParseException("unknown test type: " + name + ". Valid types: " + VALID_TYPES);
        };
    }

    /**
     * {@code ['a', "b", 'it''s']} -> {@code [a, b, it's]}.
     */
    static List<String> parseStringList(String raw) {
        String s = raw.trim();
        if (!s.startsWith("[") || !s.endsWith("]")) {
            throw new HeaderParseException("expected list syntax ['val1', 'val2'], got: " + s);
        }
        String inner = s.substring(1, s.length() - 1);
        List<String> values = new ArrayList<>();
        int i = 0;
        int n = inner.length();

        while (i < n) {
            char c = inner.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
                continue;
            }
            if (c != '\'' && c != '"') {
                throw new HeaderParseException("values must be quoted with ' or \": got unexpected char '" + c + "'");
            }
            char quote = c;
            i++;
            StringBuilder value = new StringBuilder();
            boolean closed = false;
            while (i < n) {
                char v = inner.charAt(i);
                if (v == quote) {
                    if (i + 1 < n && inner.charAt(i + 1) == quote) {
                        value.append(quote);
                        i += 2;
                        continue;
                    }
                    closed = true;
                    i++;
                    break;
                }
                value.append(v);
                i++;
            }
            if (!closed) {
                throw new HeaderParseException("unclosed quote in value list");
            }
            values.add(value.toString());
        }

        if (values.isEmpty()) {
            throw new HeaderParseException("accepted_values list cannot be empty");
        }
        return values;
    }
}
