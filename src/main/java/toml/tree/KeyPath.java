package toml.tree;

import org.apache.commons.lang3.StringUtils;
import toml.exceptions.TomlSyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class KeyPath {

    private static final KeyPath EMPTY = new KeyPath(Collections.emptyList());

    private final List<String> segments;

    private KeyPath(List<String> segments) {
        this.segments = segments;
    }

    public static KeyPath empty() {
        return EMPTY;
    }

    public static KeyPath of(String... segments) {
        List<String> list = new ArrayList<>(segments.length);
        Collections.addAll(list, segments);
        return of(list);
    }

    public static KeyPath of(List<String> segments) {
        if (segments == null || segments.isEmpty()) {
            return EMPTY;
        }
        for (String s : segments) {
            if (s == null) {
                throw new IllegalArgumentException("Key path segments must not be null: " + segments);
            }
        }
        return new KeyPath(Collections.unmodifiableList(new ArrayList<>(segments)));
    }

    public static KeyPath parse(String text) {
        return parse(text, 0);
    }

    public static KeyPath parse(String text, int lineNo) {
        if (StringUtils.isBlank(text)) {
            throw new TomlSyntaxException("Empty key or table name", lineNo);
        }
        return new Scanner(text, lineNo).scan();
    }

    public List<String> getSegments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public boolean isDotted() {
        return segments.size() > 1;
    }

    public String last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Empty key path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    public KeyPath parent() {
        if (segments.size() <= 1) {
            return EMPTY;
        }
        return new KeyPath(segments.subList(0, segments.size() - 1));
    }

    public KeyPath child(String segment) {
        List<String> list = new ArrayList<>(segments);
        list.add(segment);
        return of(list);
    }

    public static String quoteSegment(String segment) {
        if (segment.isEmpty()) {
            return "\"\"";
        }
        boolean needsQuotes = false;
        for (int i = 0; i < segment.length() && !needsQuotes; i++) {
            char c = segment.charAt(i);
            needsQuotes = c == '.' || c == '[' || c == ']' || Character.isWhitespace(c) || c == '"' || c == '\'';
        }
        if (!needsQuotes) {
            return segment;
        }
        if (segment.indexOf('"') < 0) {
            return '"' + segment + '"';
        }
        if (segment.indexOf('\'') < 0) {
            return '\'' + segment + '\'';
        }
        return '"' + segment.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String s : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(quoteSegment(s));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyPath)) {
            return false;
        }
        return segments.equals(((KeyPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    private static final class Scanner {
        private final String text;
        private final int lineNo;
        private final List<String> out = new ArrayList<>();
        private int pos;

        Scanner(String text, int lineNo) {
            this.text = text;
            this.lineNo = lineNo;
        }

        KeyPath scan() {
            while (true) {
                skipWhitespace();
                out.add(readSegment());
                skipWhitespace();
                if (pos >= text.length()) {
                    return of(out);
                }
                char c = text.charAt(pos);
                if (c != '.') {
                    throw error("Unexpected character '" + c + "'");
                }
                pos++;
            }
        }

        private String readSegment() {
            if (pos >= text.length()) {
                throw error("Empty segment");
            }
            char c = text.charAt(pos);
            if (c == '"') {
                return readBasic();
            }
            if (c == '\'') {
                return readLiteral();
            }
            int start = pos;
            while (pos < text.length() && isBareKeyChar(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw error(c == '.' ? "Empty segment" : "Unexpected character '" + c + "'");
            }
            return text.substring(start, pos);
        }

        private String readBasic() {
            StringBuilder sb = new StringBuilder();
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c == '\\' && pos < text.length()) {
                    char next = text.charAt(pos++);
                    if (next == '"' || next == '\\') {
                        sb.append(next);
                    } else {
                        sb.append(c).append(next);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw error("Unterminated quoted segment");
        }

        private String readLiteral() {
            int close = text.indexOf('\'', pos + 1);
            if (close < 0) {
                throw error("Unterminated quoted segment");
            }
            String segment = text.substring(pos + 1, close);
            pos = close + 1;
            return segment;
        }

        private void skipWhitespace() {
            while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
                pos++;
            }
        }

        private static boolean isBareKeyChar(char c) {
            return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
        }

        private TomlSyntaxException error(String reason) {
            return new TomlSyntaxException(reason + " in key <" + text.trim() + ">", lineNo);
        }
    }
}
