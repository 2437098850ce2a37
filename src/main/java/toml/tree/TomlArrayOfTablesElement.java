package toml.tree;

public class TomlArrayOfTablesElement extends TomlNode {

    public TomlArrayOfTablesElement(int lineNo) {
        super(TECHNICAL_NODE, lineNo);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY_ELEMENT;
    }

    @Override
    public boolean canHostKeyValues() {
        return true;
    }

    @Override
    protected String describe() {
        return "TomlArrayOfTablesElement (technical_node)";
    }
}
