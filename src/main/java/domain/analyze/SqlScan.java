package domain.analyze;

/**
 * Character cursor over SQL text that can step over comments, quoted strings, quoted identifiers
 * and PostgreSQL dollar-quoted bodies as atomic tokens.
 */
final class SqlScan {
    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    /** {@code $$} or {@code $tag$}. */
    boolean peekIsDollarQuote() {
        return dollarTagEnd() > 0;
    }

    private int dollarTagEnd() {
        if (pos >= s.length() || s.charAt(pos) != '$') return -1;
        if (pos > 0 && (Character.isLetterOrDigit(s.charAt(pos - 1)) || s.charAt(pos - 1) == '_')) return -1;
        int p = pos + 1;
        while (p < s.length() && (Character.isLetter(s.charAt(p)) || s.charAt(p) == '_')) p++;
        return (p < s.length() && s.charAt(p) == '$') ? p + 1 : -1;
    }

    String readDollarQuoted() {
        int start = pos;
        int tagEnd = dollarTagEnd();
        String tag = s.substring(pos, tagEnd);
        int close = s.indexOf(tag, tagEnd);
        pos = close < 0 ? s.length() : close + tag.length();
        return s.substring(start, pos);
    }

    String readDoubleQuotedString() {
        int start = pos;
        pos++; // "
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '"') {
                if (pos < s.length() && s.charAt(pos) == '"') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos + 1 < s.length()) {
            if (s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        pos = s.length();
        return s.substring(start, pos);
    }

    String readSingleQuotedString() {
        int start = pos;
        pos++; // '
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\'') {
                // escaped ''
                if (pos < s.length() && s.charAt(pos) == '\'') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }
}
