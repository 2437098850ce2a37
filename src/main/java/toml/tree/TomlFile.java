package toml.tree;

public class TomlFile extends TomlNode {

    public TomlFile() {
        super("rootNode", 0);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FILE;
    }

    @Override
    public boolean canHostKeyValues() {
        return true;
    }

    @Override
    protected String describe() {
        return "TomlFile (rootNode)";
    }
}
