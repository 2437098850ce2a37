package toml.tree;

import java.util.List;

public class TomlKeyValueArray extends TomlKeyValue {

    public TomlKeyValueArray(String key, TomlValue value, int lineNo) {
        this(key, value, lineNo, null, null);
    }

    public TomlKeyValueArray(String key, TomlValue value, int lineNo, List<String> comments, String inlineComment) {
        super(key, value, lineNo, comments, inlineComment);
        if (value.getType() != TomlValue.Type.ARRAY) {
            throw new IllegalArgumentException("Array key-value <" + key + "> cannot hold " + value.getType());
        }
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.KEY_VALUE_ARRAY;
    }

    public List<TomlValue> getElements() {
        return getValue().getElements();
    }
}
