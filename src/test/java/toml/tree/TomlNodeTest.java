package toml.tree;

import org.junit.jupiter.api.Test;
import toml.exceptions.InvalidInsertionTargetException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TomlNodeTest {

    @Test
    void childrenKeepAppendOrderRegardlessOfKind() {
        var file = new TomlFile();
        var first = new TomlKeyValuePrimitive("z", TomlValue.scalar("1"), 1);
        var table = new TomlTable("a", TableType.PRIMITIVE, 2, true);
        var last = new TomlKeyValuePrimitive("b", TomlValue.scalar("2"), 3);

        file.appendChild(first);
        file.appendChild(table);
        file.appendChild(last);

        assertEquals(List.of(first, table, last), file.getChildren());
        assertSame(file, table.getParent());
        assertSame(first, file.getFirstChild());
        assertSame(last, file.getLastChild());
    }

    @Test
    void fullPathSkipsArrayElementsAndQuotesSegments() {
        var file = new TomlFile();
        var fruits = new TomlTable("fruits", TableType.ARRAY, 1, true);
        var element = new TomlArrayOfTablesElement(1);
        var physical = new TomlTable("physical.props", TableType.PRIMITIVE, 2, true);
        var color = new TomlKeyValuePrimitive("color", TomlValue.scalar("\"red\""), 3);
        file.appendChild(fruits);
        fruits.appendChild(element);
        element.appendChild(physical);
        physical.appendChild(color);

        assertTrue(file.getFullPath().isEmpty());
        assertEquals(KeyPath.of("fruits"), element.getFullPath());
        assertEquals("fruits.\"physical.props\"", physical.getFullPath().toString());
        assertEquals(KeyPath.of("fruits", "physical.props", "color"), color.getFullPath());
        assertSame(element, fruits.getLatestElement());
    }

    @Test
    void kindTags() {
        assertEquals(NodeKind.FILE, new TomlFile().getKind());
        assertEquals(NodeKind.TABLE, new TomlTable("t", TableType.ARRAY, 1, true).getKind());
        assertEquals(NodeKind.ARRAY_ELEMENT, new TomlArrayOfTablesElement(1).getKind());
        assertEquals(NodeKind.KEY_VALUE_PRIMITIVE, new TomlKeyValuePrimitive("k", TomlValue.nullValue(), 1).getKind());
        assertEquals(NodeKind.KEY_VALUE_ARRAY, new TomlKeyValueArray("k", TomlValue.array(List.of()), 1).getKind());
        assertEquals(NodeKind.STUB, new TomlStubEmptyNode(1).getKind());
    }

    @Test
    void nullMarkerIsVisibleOnKeyValue() {
        var nullValue = new TomlKeyValuePrimitive("k", TomlValue.nullValue(), 4);
        var scalar = new TomlKeyValuePrimitive("k", TomlValue.scalar("\"null\""), 5);

        assertTrue(nullValue.isNull());
        assertNull(nullValue.getValue().getContent());
        assertFalse(scalar.isNull());
        assertEquals(4, nullValue.getLineNo());
    }

    @Test
    void arrayTableOnlyAcceptsElements() {
        var array = new TomlTable("a", TableType.ARRAY, 1, true);

        assertThrows(InvalidInsertionTargetException.class,
                () -> array.appendChild(new TomlKeyValuePrimitive("k", TomlValue.scalar("1"), 2)));
        assertThrows(InvalidInsertionTargetException.class,
                () -> array.appendChild(new TomlTable("b", TableType.PRIMITIVE, 2, true)));
        assertFalse(array.hasChildren());
    }

    @Test
    void leafNodesRejectChildren() {
        var keyValue = new TomlKeyValuePrimitive("k", TomlValue.scalar("1"), 1);
        var stub = new TomlStubEmptyNode(1);

        assertThrows(InvalidInsertionTargetException.class, () -> keyValue.appendChild(new TomlStubEmptyNode(1)));
        assertThrows(InvalidInsertionTargetException.class, () -> stub.appendChild(new TomlStubEmptyNode(1)));
        assertFalse(keyValue.canHostKeyValues());
    }

    @Test
    void nodeCannotBeAttachedTwice() {
        var file = new TomlFile();
        var table = new TomlTable("a", TableType.PRIMITIVE, 1, true);
        var keyValue = new TomlKeyValuePrimitive("k", TomlValue.scalar("1"), 2);
        file.appendChild(keyValue);

        assertThrows(InvalidInsertionTargetException.class, () -> table.appendChild(keyValue));
        assertFalse(table.hasChildren());
    }

    @Test
    void primitiveKeyValueRejectsArrayPayload() {
        assertThrows(IllegalArgumentException.class,
                () -> new TomlKeyValuePrimitive("k", TomlValue.array(List.of()), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new TomlKeyValueArray("k", TomlValue.scalar("1"), 1));
    }

    @Test
    void prettyStrIndentsByDepth() {
        var file = new TomlFile();
        var table = new TomlTable("a", TableType.PRIMITIVE, 1, true);
        file.appendChild(table);
        table.appendChild(new TomlKeyValueArray("ports",
                TomlValue.array(List.of(TomlValue.scalar("1"), TomlValue.scalar("2"))), 2));

        var expected = " - TomlFile (rootNode)\n" +
                "     - TomlTable ([a])\n" +
                "         - TomlKeyValueArray (ports=[1, 2])\n";
        assertEquals(expected, file.prettyStr());
    }
}
