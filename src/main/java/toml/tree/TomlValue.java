package toml.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TomlValue {

    public enum Type {
        NULL,
        SCALAR,
        ARRAY,
        INLINE_TABLE
    }

    private static final TomlValue NULL_VALUE = new TomlValue(Type.NULL, null, Collections.emptyList(), Collections.emptyList());

    private final Type type;
    private final String raw;
    private final List<TomlValue> elements;
    private final List<Entry> entries;

    private TomlValue(Type type, String raw, List<TomlValue> elements, List<Entry> entries) {
        this.type = type;
        this.raw = raw;
        this.elements = elements;
        this.entries = entries;
    }

    public static TomlValue nullValue() {
        return NULL_VALUE;
    }

    public static TomlValue scalar(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Scalar payload must not be null, use nullValue() instead");
        }
        return new TomlValue(Type.SCALAR, raw, Collections.emptyList(), Collections.emptyList());
    }

    public static TomlValue array(List<TomlValue> elements) {
        return new TomlValue(Type.ARRAY, null, Collections.unmodifiableList(new ArrayList<>(elements)), Collections.emptyList());
    }

    public static TomlValue inlineTable(List<Entry> entries) {
        return new TomlValue(Type.INLINE_TABLE, null, Collections.emptyList(), Collections.unmodifiableList(new ArrayList<>(entries)));
    }

    public Type getType() {
        return type;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public String getRaw() {
        return raw;
    }

    public List<TomlValue> getElements() {
        return elements;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public Object getContent() {
        if (type == Type.SCALAR) {
            return raw;
        }
        if (type == Type.ARRAY) {
            List<Object> content = new ArrayList<>(elements.size());
            for (TomlValue v : elements) {
                content.add(v.getContent());
            }
            return content;
        }
        if (type == Type.INLINE_TABLE) {
            return toString();
        }
        return null;
    }

    @Override
    public String toString() {
        switch (type) {
            case SCALAR:
                return raw;
            case ARRAY: {
                StringBuilder sb = new StringBuilder("[");
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(elements.get(i));
                }
                return sb.append(']').toString();
            }
            case INLINE_TABLE: {
                if (entries.isEmpty()) {
                    return "{}";
                }
                StringBuilder sb = new StringBuilder("{ ");
                for (int i = 0; i < entries.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    Entry e = entries.get(i);
                    sb.append(e.getKey()).append(" = ").append(e.getValue());
                }
                return sb.append(" }").toString();
            }
            default:
                return "null";
        }
    }

    public static final class Entry {
        private final KeyPath key;
        private final TomlValue value;

        public Entry(KeyPath key, TomlValue value) {
            this.key = key;
            this.value = value;
        }

        public KeyPath getKey() {
            return key;
        }

        public TomlValue getValue() {
            return value;
        }
    }
}
