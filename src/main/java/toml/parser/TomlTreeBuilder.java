package toml.parser;

import lombok.extern.slf4j.Slf4j;
import toml.exceptions.InvalidInsertionTargetException;
import toml.exceptions.StructuralKindConflictException;
import toml.tree.KeyPath;
import toml.tree.TableType;
import toml.tree.TomlArrayOfTablesElement;
import toml.tree.TomlFile;
import toml.tree.TomlKeyValue;
import toml.tree.TomlKeyValueArray;
import toml.tree.TomlKeyValuePrimitive;
import toml.tree.TomlNode;
import toml.tree.TomlTable;
import toml.tree.TomlValue;

import java.util.Collections;
import java.util.List;

/**
 * Builds the tree from structural lines in file order. Headers resolve from the root and move the
 * current scope; key-values resolve from the current scope.
 */
@Slf4j
public class TomlTreeBuilder {

    private final TomlFile root = new TomlFile();
    private final TablePathResolver resolver = new TablePathResolver();
    private TomlNode currentScope = root;
    private boolean finished;

    public void accept(TomlLine line) {
        if (finished) {
            throw new IllegalStateException("Tree has already been finalized, line " + line.getLineNo() + " is too late");
        }
        log.trace("Line {}: {} {}", line.getLineNo(), line.getKind(), line.getPath());
        switch (line.getKind()) {
            case TABLE:
                onTable(line);
                break;
            case ARRAY_OF_TABLES:
                onArrayOfTables(line);
                break;
            default:
                onKeyValue(line);
                break;
        }
    }

    public TomlFile finish() {
        if (!finished) {
            int stubs = TreeFinalizer.finalizeTree(root);
            log.trace("Inserted {} stub nodes", stubs);
            finished = true;
        }
        return root;
    }

    public TomlNode getCurrentScope() {
        return currentScope;
    }

    private void onTable(TomlLine line) {
        KeyPath path = line.getPath();
        int lineNo = line.getLineNo();
        String name = path.last();

        TomlNode parent = resolver.resolveParent(root, path, lineNo);
        TomlNode existing = resolver.findChild(parent, name);
        if (existing instanceof TomlKeyValue) {
            throw new StructuralKindConflictException(
                    "Table [" + path + "] is already defined as a key-value on line " + existing.getLineNo(), lineNo);
        }

        TomlTable table;
        if (existing == null) {
            table = appendTable(parent, name, TableType.PRIMITIVE, lineNo);
        } else {
            TomlTable found = (TomlTable) existing;
            if (found.isArray()) {
                table = appendTable(found.getLatestElement(), name, TableType.PRIMITIVE, lineNo);
            } else if (!found.isDeclared()) {
                found.markDeclared();
                table = found;
            } else {
                log.debug("Table [{}] on line {} redefines the table from line {}, adding a sibling",
                        path, lineNo, found.getLineNo());
                table = appendTable(parent, name, TableType.PRIMITIVE, lineNo);
            }
        }
        currentScope = table;
    }

    private void onArrayOfTables(TomlLine line) {
        KeyPath path = line.getPath();
        int lineNo = line.getLineNo();
        String name = path.last();

        TomlNode parent = resolver.resolveParent(root, path, lineNo);
        TomlTable array = resolver.findArrayTable(parent, name);
        if (array == null) {
            TomlNode existing = resolver.findChild(parent, name);
            if (existing instanceof TomlKeyValue) {
                throw new StructuralKindConflictException(
                        "Array of tables [[" + path + "]] is already defined as a key-value on line "
                                + existing.getLineNo(), lineNo);
            }
            array = appendTable(parent, name, TableType.ARRAY, lineNo);
        }

        TomlArrayOfTablesElement element = new TomlArrayOfTablesElement(lineNo);
        array.appendChild(element);
        log.debug("Array of tables [[{}]] element #{} opened on line {}", path, array.getChildren().size(), lineNo);
        currentScope = element;
    }

    private void onKeyValue(TomlLine line) {
        if (!currentScope.canHostKeyValues()) {
            throw new InvalidInsertionTargetException(
                    "Key-value <" + line.getPath() + "> cannot be inserted into <" + currentScope + ">", line.getLineNo());
        }
        if (line.getValue().getType() == TomlValue.Type.INLINE_TABLE) {
            insertInlineTable(currentScope, line.getPath(), line.getValue(), line.getLineNo());
        } else {
            insertKeyValue(currentScope, line.getPath(), line.getValue(), line.getLineNo(),
                    line.getComments(), line.getInlineComment());
        }
    }

    private void insertKeyValue(TomlNode scope, KeyPath key, TomlValue value, int lineNo,
                                List<String> comments, String inlineComment) {
        TomlNode parent = resolver.resolveParent(scope, key, lineNo);
        String name = key.last();
        TomlNode existing = resolver.findChild(parent, name);
        if (existing instanceof TomlTable) {
            throw new StructuralKindConflictException(
                    "Key <" + existing.getFullPath() + "> is already defined as a table on line " + existing.getLineNo(),
                    lineNo);
        }
        parent.appendChild(createKeyValue(name, value, lineNo, comments, inlineComment));
    }

    private void insertInlineTable(TomlNode scope, KeyPath key, TomlValue value, int lineNo) {
        TomlTable table = new TomlTable(key.last(), TableType.PRIMITIVE, lineNo, true);
        for (TomlValue.Entry entry : value.getEntries()) {
            if (entry.getValue().getType() == TomlValue.Type.INLINE_TABLE) {
                insertInlineTable(table, entry.getKey(), entry.getValue(), lineNo);
            } else {
                insertKeyValue(table, entry.getKey(), entry.getValue(), lineNo, Collections.emptyList(), null);
            }
        }

        TomlNode parent = resolver.resolveParent(scope, key, lineNo);
        TomlNode existing = resolver.findChild(parent, key.last());
        if (existing != null) {
            throw new StructuralKindConflictException(
                    "Inline table <" + existing.getFullPath() + "> is already defined on line " + existing.getLineNo(),
                    lineNo);
        }
        parent.appendChild(table);
    }

    private TomlTable appendTable(TomlNode parent, String name, TableType type, int lineNo) {
        TomlTable table = new TomlTable(name, type, lineNo, true);
        parent.appendChild(table);
        log.debug("Table {} created on line {}", table, lineNo);
        return table;
    }

    private static TomlKeyValue createKeyValue(String name, TomlValue value, int lineNo,
                                               List<String> comments, String inlineComment) {
        if (value.getType() == TomlValue.Type.ARRAY) {
            return new TomlKeyValueArray(name, value, lineNo, comments, inlineComment);
        }
        return new TomlKeyValuePrimitive(name, value, lineNo, comments, inlineComment);
    }
}
