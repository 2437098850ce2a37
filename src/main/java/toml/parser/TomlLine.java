package toml.parser;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.Validate;
import toml.tree.KeyPath;
import toml.tree.TomlValue;

import java.util.Collections;
import java.util.List;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TomlLine {

    public enum Kind {
        TABLE,
        ARRAY_OF_TABLES,
        KEY_VALUE
    }

    private final Kind kind;
    private final KeyPath path;
    private final TomlValue value;
    private final int lineNo;
    private final List<String> comments;
    private final String inlineComment;

    public static TomlLine table(KeyPath path, int lineNo) {
        return header(Kind.TABLE, path, lineNo);
    }

    public static TomlLine arrayOfTables(KeyPath path, int lineNo) {
        return header(Kind.ARRAY_OF_TABLES, path, lineNo);
    }

    public static TomlLine keyValue(KeyPath key, TomlValue value, int lineNo) {
        return keyValue(key, value, lineNo, Collections.emptyList(), null);
    }

    public static TomlLine keyValue(KeyPath key, TomlValue value, int lineNo, List<String> comments, String inlineComment) {
        Validate.isTrue(key != null && !key.isEmpty(), "Key-value line %d has no key", lineNo);
        Validate.notNull(value, "Key-value line %d has no value", lineNo);
        List<String> copy = comments == null ? Collections.emptyList() : List.copyOf(comments);
        return new TomlLine(Kind.KEY_VALUE, key, value, lineNo, copy, inlineComment);
    }

    private static TomlLine header(Kind kind, KeyPath path, int lineNo) {
        Validate.isTrue(path != null && !path.isEmpty(), "Header line %d has no table name", lineNo);
        return new TomlLine(kind, path, null, lineNo, Collections.emptyList(), null);
    }

    public boolean isHeader() {
        return kind != Kind.KEY_VALUE;
    }
}
