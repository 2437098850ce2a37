package toml.tree;

public class TomlStubEmptyNode extends TomlNode {

    public TomlStubEmptyNode(int lineNo) {
        super(TECHNICAL_NODE, lineNo);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STUB;
    }

    @Override
    protected String describe() {
        return "TomlStubEmptyNode (technical_node)";
    }
}
