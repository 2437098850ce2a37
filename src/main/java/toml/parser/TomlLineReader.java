package toml.parser;

import lombok.extern.slf4j.Slf4j;
import toml.exceptions.TomlSyntaxException;
import toml.tree.KeyPath;
import toml.tree.TomlValue;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class TomlLineReader {

    private static final String BASIC_MULTILINE = "\"\"\"";
    private static final String LITERAL_MULTILINE = "'''";

    private final TomlInputConfig config;

    public TomlLineReader() {
        this(TomlInputConfig.defaults());
    }

    public TomlLineReader(TomlInputConfig config) {
        this.config = config;
    }

    public List<TomlLine> readLines(String text) {
        ReadContext ctx = new ReadContext(splitLines(text == null ? "" : text));
        while (ctx.hasNext()) {
            processRawLine(ctx);
        }
        log.trace("Read {} structural lines out of {} physical lines", ctx.out.size(), ctx.lines.size());
        return ctx.out;
    }

    private void processRawLine(ReadContext ctx) {
        int lineNo = ctx.nextLineNo();
        String trimmed = ctx.next().trim();

        if (trimmed.isEmpty()) {
            ctx.pendingComments.clear();
            return;
        }
        if (trimmed.startsWith("#")) {
            ctx.pendingComments.add(trimmed);
            return;
        }
        if (trimmed.startsWith("[")) {
            ctx.out.add(parseHeader(trimmed, lineNo));
        } else {
            ctx.out.add(parseKeyValue(ctx, trimmed, lineNo));
        }
        ctx.pendingComments.clear();
    }

    private static TomlLine parseHeader(String trimmed, int lineNo) {
        String content = CommentSplit.of(trimmed).content.trim();
        if (content.startsWith("[[")) {
            if (content.length() < 4 || !content.endsWith("]]")) {
                throw new TomlSyntaxException("Array of tables header must be closed with ']]': " + content, lineNo);
            }
            KeyPath path = KeyPath.parse(content.substring(2, content.length() - 2), lineNo);
            return TomlLine.arrayOfTables(path, lineNo);
        }
        if (content.length() < 2 || !content.endsWith("]")) {
            throw new TomlSyntaxException("Table header must be closed with ']': " + content, lineNo);
        }
        KeyPath path = KeyPath.parse(content.substring(1, content.length() - 1), lineNo);
        return TomlLine.table(path, lineNo);
    }

    private TomlLine parseKeyValue(ReadContext ctx, String trimmed, int lineNo) {
        int eq = indexOfOutsideStrings(trimmed, '=');
        if (eq < 0) {
            throw new TomlSyntaxException("Incorrect format of key-value pair, expected <key = value>: " + trimmed, lineNo);
        }
        KeyPath key = KeyPath.parse(trimmed.substring(0, eq), lineNo);
        ValueText valueText = readValueText(ctx, trimmed.substring(eq + 1), lineNo);
        TomlValue value = parseValue(valueText.text, lineNo);
        return TomlLine.keyValue(key, value, lineNo, new ArrayList<>(ctx.pendingComments), valueText.comment);
    }

    private static ValueText readValueText(ReadContext ctx, String rest, int lineNo) {
        String lead = rest.stripLeading();
        if (lead.startsWith(BASIC_MULTILINE) || lead.startsWith(LITERAL_MULTILINE)) {
            return readMultilineString(ctx, lead, lineNo);
        }

        CommentSplit split = CommentSplit.of(rest);
        StringBuilder text = new StringBuilder(split.content);
        while (bracketDepth(text) > 0) {
            if (!ctx.hasNext()) {
                throw new TomlSyntaxException("Array or inline table is not closed before the end of input", lineNo);
            }
            text.append('\n').append(CommentSplit.of(ctx.next()).content);
        }
        return new ValueText(text.toString().trim(), split.comment);
    }

    private static ValueText readMultilineString(ReadContext ctx, String lead, int lineNo) {
        String delimiter = lead.substring(0, 3);
        boolean basic = BASIC_MULTILINE.equals(delimiter);
        StringBuilder text = new StringBuilder(lead);
        int close = findClosingDelimiter(text, delimiter, basic);
        while (close < 0) {
            if (!ctx.hasNext()) {
                throw new TomlSyntaxException("Multi-line string is not closed before the end of input", lineNo);
            }
            text.append('\n').append(ctx.next());
            close = findClosingDelimiter(text, delimiter, basic);
        }
        CommentSplit tail = CommentSplit.of(text.substring(close + 3));
        if (!tail.content.isBlank()) {
            throw new TomlSyntaxException("Unexpected text after multi-line string: " + tail.content.trim(), lineNo);
        }
        return new ValueText(text.substring(0, close + 3), tail.comment);
    }

    private static int findClosingDelimiter(CharSequence text, String delimiter, boolean basic) {
        int i = 3;
        while (i + 3 <= text.length()) {
            char c = text.charAt(i);
            if (basic && c == '\\') {
                i += 2;
                continue;
            }
            if (text.subSequence(i, i + 3).toString().equals(delimiter)) {
                // up to two quotes right before the delimiter belong to the content
                int close = i;
                while (close - i < 2 && close + 3 < text.length() && text.charAt(close + 3) == delimiter.charAt(0)) {
                    close++;
                }
                return close;
            }
            i++;
        }
        return -1;
    }

    TomlValue parseValue(String text, int lineNo) {
        String t = text.trim();
        if (t.isEmpty()) {
            if (!config.isAllowEmptyValues()) {
                throw new TomlSyntaxException("Empty value is not allowed", lineNo);
            }
            return TomlValue.nullValue();
        }
        if ("null".equals(t) || "nil".equals(t)) {
            if (!config.isAllowNullValues()) {
                throw new TomlSyntaxException("Null values are not allowed", lineNo);
            }
            return TomlValue.nullValue();
        }

        char first = t.charAt(0);
        if (first == '[') {
            return parseArray(t, lineNo);
        }
        if (first == '{') {
            return parseInlineTable(t, lineNo);
        }
        if ((first == '"' || first == '\'') && skipString(t, 0) > t.length()) {
            throw new TomlSyntaxException("String value is not closed: " + t, lineNo);
        }
        return TomlValue.scalar(t);
    }

    private TomlValue parseArray(String t, int lineNo) {
        if (!t.endsWith("]")) {
            throw new TomlSyntaxException("Array must be closed with ']': " + t, lineNo);
        }
        List<String> pieces = splitOutsideStrings(t.substring(1, t.length() - 1), ',');
        List<TomlValue> elements = new ArrayList<>();
        for (int i = 0; i < pieces.size(); i++) {
            String piece = pieces.get(i).trim();
            if (piece.isEmpty()) {
                boolean emptyArray = pieces.size() == 1;
                boolean trailingComma = i == pieces.size() - 1 && i > 0;
                if (emptyArray || trailingComma) {
                    continue;
                }
                throw new TomlSyntaxException("Missing array element: " + t, lineNo);
            }
            elements.add(parseValue(piece, lineNo));
        }
        return TomlValue.array(elements);
    }

    private TomlValue parseInlineTable(String t, int lineNo) {
        if (!t.endsWith("}")) {
            throw new TomlSyntaxException("Inline table must be closed with '}': " + t, lineNo);
        }
        String inner = t.substring(1, t.length() - 1);
        List<TomlValue.Entry> entries = new ArrayList<>();
        if (inner.isBlank()) {
            return TomlValue.inlineTable(entries);
        }
        for (String piece : splitOutsideStrings(inner, ',')) {
            int eq = indexOfOutsideStrings(piece, '=');
            if (eq < 0) {
                throw new TomlSyntaxException("Incorrect inline table entry, expected <key = value>: " + piece.trim(), lineNo);
            }
            KeyPath key = KeyPath.parse(piece.substring(0, eq), lineNo);
            entries.add(new TomlValue.Entry(key, parseValue(piece.substring(eq + 1), lineNo)));
        }
        return TomlValue.inlineTable(entries);
    }

    static List<String> splitLines(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>();
        for (String line : normalized.split("\n", -1)) {
            lines.add(line);
        }
        return lines;
    }

    /**
     * Index just past the string literal that opens at {@code start}; greater than the length when unterminated.
     */
    static int skipString(CharSequence s, int start) {
        char quote = s.charAt(start);
        int i = start + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (quote == '"' && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return s.length() + 1;
    }

    static int indexOfOutsideStrings(CharSequence s, char target) {
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(s, i);
                continue;
            }
            if (c == target) {
                return i;
            }
            i++;
        }
        return -1;
    }

    static int bracketDepth(CharSequence s) {
        int depth = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(s, i);
                continue;
            }
            if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
            }
            i++;
        }
        return depth;
    }

    static List<String> splitOutsideStrings(String s, char separator) {
        List<String> pieces = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                i = Math.min(skipString(s, i), s.length());
                continue;
            }
            if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                pieces.add(s.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        pieces.add(s.substring(start));
        return pieces;
    }

    private static final class ReadContext {
        final List<String> lines;
        final List<TomlLine> out = new ArrayList<>();
        final List<String> pendingComments = new ArrayList<>();
        int index;

        ReadContext(List<String> lines) {
            this.lines = lines;
        }

        boolean hasNext() {
            return index < lines.size();
        }

        int nextLineNo() {
            return index + 1;
        }

        String next() {
            return lines.get(index++);
        }
    }

    private static final class CommentSplit {
        final String content;
        final String comment;

        private CommentSplit(String content, String comment) {
            this.content = content;
            this.comment = comment;
        }

        static CommentSplit of(String line) {
            int hash = indexOfOutsideStrings(line, '#');
            if (hash < 0) {
                return new CommentSplit(line, null);
            }
            return new CommentSplit(line.substring(0, hash), line.substring(hash).trim());
        }
    }

    private static final class ValueText {
        final String text;
        final String comment;

        ValueText(String text, String comment) {
            this.text = text;
            this.comment = comment;
        }
    }
}
