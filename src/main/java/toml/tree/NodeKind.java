package toml.tree;

public enum NodeKind {
    FILE,
    TABLE,
    ARRAY_ELEMENT,
    KEY_VALUE_PRIMITIVE,
    KEY_VALUE_ARRAY,
    STUB
}
