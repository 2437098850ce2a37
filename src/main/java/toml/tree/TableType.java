package toml.tree;

public enum TableType {
    PRIMITIVE,
    ARRAY
}
