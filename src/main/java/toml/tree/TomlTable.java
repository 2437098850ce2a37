package toml.tree;

import toml.exceptions.InvalidInsertionTargetException;

/**
 * Tables created only as intermediate path segments stay undeclared until a header names them.
 */
public class TomlTable extends TomlNode {

    private final TableType type;
    private boolean declared;

    public TomlTable(String name, TableType type, int lineNo, boolean declared) {
        super(name, lineNo);
        this.type = type;
        this.declared = declared;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TABLE;
    }

    public TableType getType() {
        return type;
    }

    public boolean isArray() {
        return type == TableType.ARRAY;
    }

    public boolean isDeclared() {
        return declared;
    }

    public void markDeclared() {
        this.declared = true;
    }

    public TomlArrayOfTablesElement getLatestElement() {
        if (!isArray()) {
            throw new IllegalStateException("Table <" + getFullPath() + "> is not an array of tables");
        }
        return (TomlArrayOfTablesElement) getLastChild();
    }

    @Override
    public boolean canHostKeyValues() {
        return type == TableType.PRIMITIVE;
    }

    @Override
    protected void checkCanAppend(TomlNode child) {
        if (type == TableType.ARRAY && child.getKind() != NodeKind.ARRAY_ELEMENT) {
            throw new InvalidInsertionTargetException(
                    "Array of tables <" + getFullPath() + "> can only contain array elements, got <" + child + ">",
                    child.getLineNo());
        }
        if (type == TableType.PRIMITIVE) {
            super.checkCanAppend(child);
        }
    }

    @Override
    protected boolean isPathSegment() {
        return true;
    }

    @Override
    protected String describe() {
        return type == TableType.ARRAY ? "TomlTable ([[" + getFullPath() + "]])" : "TomlTable ([" + getFullPath() + "])";
    }
}
