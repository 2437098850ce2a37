package toml.tree;

import java.util.List;

public class TomlKeyValuePrimitive extends TomlKeyValue {

    public TomlKeyValuePrimitive(String key, TomlValue value, int lineNo) {
        this(key, value, lineNo, null, null);
    }

    public TomlKeyValuePrimitive(String key, TomlValue value, int lineNo, List<String> comments, String inlineComment) {
        super(key, value, lineNo, comments, inlineComment);
        if (value.getType() == TomlValue.Type.ARRAY || value.getType() == TomlValue.Type.INLINE_TABLE) {
            throw new IllegalArgumentException("Primitive key-value <" + key + "> cannot hold " + value.getType());
        }
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.KEY_VALUE_PRIMITIVE;
    }
}
