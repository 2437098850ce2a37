package toml.parser;

import toml.tree.NodeKind;
import toml.tree.TomlNode;
import toml.tree.TomlStubEmptyNode;
import toml.tree.TomlTable;

import java.util.ArrayDeque;
import java.util.Deque;

public final class TreeFinalizer {

    private TreeFinalizer() {
    }

    public static int finalizeTree(TomlNode root) {
        int inserted = 0;
        Deque<TomlNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TomlNode node = stack.pop();
            if (needsStub(node)) {
                node.appendChild(new TomlStubEmptyNode(node.getLineNo()));
                inserted++;
                continue;
            }
            for (TomlNode child : node.getChildren()) {
                stack.push(child);
            }
        }
        return inserted;
    }

    private static boolean needsStub(TomlNode node) {
        if (node.hasChildren()) {
            return false;
        }
        NodeKind kind = node.getKind();
        if (kind == NodeKind.TABLE) {
            // an array of tables only holds elements
            return !((TomlTable) node).isArray();
        }
        return kind == NodeKind.ARRAY_ELEMENT;
    }
}
