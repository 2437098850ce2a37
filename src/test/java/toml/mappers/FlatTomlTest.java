package toml.mappers;

import org.apache.commons.lang3.NotImplementedException;
import org.junit.jupiter.api.Test;
import toml.exceptions.StructuralKindConflictException;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlatTomlTest {

    private static final String READER_FEATURES = "src/test/resources/toml_tree/input_12.toml";
    private static final String FRUITS = "src/test/resources/toml_tree/input_3.toml";
    private static final String STUBS_IN_ARRAYS = "src/test/resources/toml_tree/input_7.toml";

    private final FlatToml flatToml = new FlatToml();

    @Test
    void flatToMap_flattensTablesArraysAndInlineTables() throws Exception {
        var items = flatToml.flatToMap(Files.readString(Paths.get(READER_FEATURES)));

        assertEquals("\"TOML Example\"", items.get("title").getValue());
        assertEquals("\"Tom\"", items.get("owner.name").getValue());
        assertEquals("owner", items.get("owner.name").getPath());
        assertEquals("8001", items.get("database.ports[1]").getValue());
        assertEquals("\"phi\"", items.get("database.data[0][1]").getValue());
        assertEquals("3.14", items.get("database.data[1][0]").getValue());
        assertEquals("79.5", items.get("database.temp_targets.cpu").getValue());
        assertEquals("\"omega\"", items.get("servers.alpha.hosts[1]").getValue());
        assertEquals(5, items.get("database.ports[0]").getLineNo());
    }

    @Test
    void flatToMap_keepsNullValuesAndComments() throws Exception {
        var items = flatToml.flatToMap(Files.readString(Paths.get(READER_FEATURES)));

        assertTrue(items.containsKey("database.enabled"));
        assertNull(items.get("database.enabled").getValue());
        assertEquals("# inline comment", items.get("owner.name").getComment());
        assertNull(items.get("title").getComment());
    }

    @Test
    void flatToMap_indexesArrayOfTablesElements() throws Exception {
        var items = flatToml.flatToMap(Files.readString(Paths.get(FRUITS)));

        assertTrue(items.keySet().stream().anyMatch(key -> key.startsWith("fruits[0].")), items.keySet().toString());
        assertTrue(items.keySet().stream().anyMatch(key -> key.startsWith("fruits[1].")), items.keySet().toString());
    }

    @Test
    void flatToMap_stubTablesBecomeEmptyPlaceholders() throws Exception {
        var items = flatToml.flatToMap(Files.readString(Paths.get(STUBS_IN_ARRAYS)));

        assertEquals(List.of("a[0].b", "a[1].b", "a[2].b"), List.copyOf(items.keySet()));
        assertEquals("", items.get("a[2].b").getValue());
    }

    @Test
    void flatToMap_quotesKeysThatNeedIt() {
        var items = flatToml.flatToMap("[site]\n\"google.com\" = true\n");

        assertEquals("true", items.get("site.\"google.com\"").getValue());
    }

    @Test
    void flatToMap_bracketsInKeysAreNotTakenForIndices() {
        var items = flatToml.flatToMap("\"a[0]\" = 1\na = [2]\n");

        assertEquals("1", items.get("\"a[0]\"").getValue());
        assertEquals("2", items.get("a[0]").getValue());
        assertEquals(2, items.size());
    }

    @Test
    void flatToMap_redefinedTableOverwritesEarlierValues() {
        var items = flatToml.flatToMap("[a]\nb = 1\n[a]\nb = 2\n");

        assertEquals(1, items.size());
        assertEquals("2", items.get("a.b").getValue());
        assertEquals(4, items.get("a.b").getLineNo());
    }

    @Test
    void flatToMap_blankInputGivesEmptyMap() {
        assertTrue(flatToml.flatToMap("").isEmpty());
        assertTrue(flatToml.flatToMap(null).isEmpty());
    }

    @Test
    void flatToString_isNotSupported() {
        var items = flatToml.flatToMap("a = 1");

        assertThrows(NotImplementedException.class, () -> flatToml.flatToString(items));
    }

    @Test
    void validate_acceptsParsedData() throws Exception {
        var items = flatToml.flatToMap(Files.readString(Paths.get(READER_FEATURES)));

        assertDoesNotThrow(() -> flatToml.validate(items));
    }

    @Test
    void validate_rejectsValueUsedAsTable() {
        Map<String, FileDataItem> items = new LinkedHashMap<>();
        items.put("a", FileDataItem.builder().key("a").value("1").lineNo(1).build());
        items.put("a.b", FileDataItem.builder().key("a.b").value("2").path("a").lineNo(2).build());

        var e = assertThrows(StructuralKindConflictException.class, () -> flatToml.validate(items));
        assertEquals(1, e.getLineNo());
    }

    @Test
    void validate_rejectsValueUsedAsArray() {
        Map<String, FileDataItem> items = new LinkedHashMap<>();
        items.put("ports", FileDataItem.builder().key("ports").value("1").lineNo(3).build());
        items.put("ports[0]", FileDataItem.builder().key("ports[0]").value("2").lineNo(4).build());

        assertThrows(StructuralKindConflictException.class, () -> flatToml.validate(items));
    }

    @Test
    void validate_rejectsMismatchedKeys() {
        Map<String, FileDataItem> items = new LinkedHashMap<>();
        items.put("a", FileDataItem.builder().key("b").value("1").build());

        assertThrows(IllegalArgumentException.class, () -> flatToml.validate(items));

        Map<String, FileDataItem> blank = new LinkedHashMap<>();
        blank.put(" ", FileDataItem.builder().key(" ").build());
        assertThrows(IllegalArgumentException.class, () -> flatToml.validate(blank));
    }
}
