package toml.tree;

import toml.exceptions.InvalidInsertionTargetException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public abstract class TomlNode {

    public static final String TECHNICAL_NODE = "technical_node";

    private final String name;
    private final int lineNo;
    private final List<TomlNode> children = new ArrayList<>();
    private TomlNode parent;

    protected TomlNode(String name, int lineNo) {
        this.name = name;
        this.lineNo = lineNo;
    }

    public abstract NodeKind getKind();

    protected abstract String describe();

    public String getName() {
        return name;
    }

    public int getLineNo() {
        return lineNo;
    }

    public TomlNode getParent() {
        return parent;
    }

    public List<TomlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public TomlNode getFirstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public TomlNode getLastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public boolean canHostKeyValues() {
        return false;
    }

    public void appendChild(TomlNode child) {
        if (child.parent != null) {
            throw new InvalidInsertionTargetException(
                    "Node <" + child.describe() + "> is already attached to <" + child.parent.describe() + ">",
                    child.getLineNo());
        }
        checkCanAppend(child);
        child.parent = this;
        children.add(child);
    }

    protected void checkCanAppend(TomlNode child) {
        if (!canHostKeyValues()) {
            throw new InvalidInsertionTargetException(
                    "Node <" + describe() + "> cannot own child <" + child.describe() + ">", child.getLineNo());
        }
    }

    protected boolean isPathSegment() {
        return false;
    }

    public KeyPath getFullPath() {
        List<String> reversed = new ArrayList<>();
        for (TomlNode node = this; node != null; node = node.parent) {
            if (node.isPathSegment()) {
                reversed.add(node.name);
            }
        }
        Collections.reverse(reversed);
        return KeyPath.of(reversed);
    }

    public String prettyStr() {
        StringBuilder sb = new StringBuilder();
        appendPretty(sb, 0);
        return sb.toString();
    }

    private void appendPretty(StringBuilder sb, int level) {
        for (int i = 0; i < level; i++) {
            sb.append("    ");
        }
        sb.append(" - ").append(describe()).append('\n');
        for (TomlNode child : children) {
            child.appendPretty(sb, level + 1);
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
