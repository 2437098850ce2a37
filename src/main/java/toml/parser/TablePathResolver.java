package toml.parser;

import lombok.extern.slf4j.Slf4j;
import toml.exceptions.UnresolvablePathException;
import toml.tree.KeyPath;
import toml.tree.TableType;
import toml.tree.TomlKeyValue;
import toml.tree.TomlNode;
import toml.tree.TomlTable;

@Slf4j
public class TablePathResolver {

    public TomlNode resolveParent(TomlNode scope, KeyPath path, int lineNo) {
        TomlNode current = scope;
        for (String segment : path.parent().getSegments()) {
            current = descend(current, segment, lineNo);
        }
        return current;
    }

    public TomlNode descend(TomlNode node, String segment, int lineNo) {
        TomlNode existing = findChild(node, segment);
        if (existing == null) {
            TomlTable created = new TomlTable(segment, TableType.PRIMITIVE, lineNo, false);
            node.appendChild(created);
            log.trace("Created implicit table <{}> at line {}", created.getFullPath(), lineNo);
            return created;
        }
        if (existing instanceof TomlKeyValue) {
            throw new UnresolvablePathException(
                    "Cannot resolve a path through <" + existing.getFullPath()
                            + ">: it is a key-value defined on line " + existing.getLineNo(),
                    lineNo);
        }
        TomlTable table = (TomlTable) existing;
        if (table.isArray()) {
            return table.getLatestElement();
        }
        return table;
    }

    /**
     * Latest table or key-value child with the given name. The first one seen fixes the kind, so a later
     * array of tables next to a primitive table of the same name is skipped.
     */
    public TomlNode findChild(TomlNode parent, String name) {
        TomlNode first = null;
        TomlNode latest = null;
        for (TomlNode child : parent.getChildren()) {
            if (!(child instanceof TomlTable || child instanceof TomlKeyValue) || !name.equals(child.getName())) {
                continue;
            }
            if (first == null) {
                first = child;
            }
            if (sameKind(first, child)) {
                latest = child;
            }
        }
        return latest;
    }

    private static boolean sameKind(TomlNode a, TomlNode b) {
        if (a instanceof TomlKeyValue && b instanceof TomlKeyValue) {
            return true;
        }
        if (a instanceof TomlTable && b instanceof TomlTable) {
            return ((TomlTable) a).getType() == ((TomlTable) b).getType();
        }
        return a.getKind() == b.getKind();
    }

    public TomlTable findArrayTable(TomlNode parent, String name) {
        for (TomlNode child : parent.getChildren()) {
            if (child instanceof TomlTable && ((TomlTable) child).isArray() && name.equals(child.getName())) {
                return (TomlTable) child;
            }
        }
        return null;
    }
}
