package toml.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import toml.exceptions.EmptyTomlException;
import toml.exceptions.StructuralKindConflictException;
import toml.exceptions.TomlParseException;
import toml.tree.TomlKeyValue;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TomlParserTest {

    private static final String TREE_DIR = "src/test/resources/toml_tree/";

    private final TomlParser parser = new TomlParser();

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14})
    void parseString_buildsExpectedTree(int number) throws Exception {
        var input = Files.readString(Paths.get(TREE_DIR + "input_" + number + ".toml"));
        var expected = Files.readString(Paths.get(TREE_DIR + "expected_" + number + ".txt"));

        assertEquals(expected, parser.parseString(input).prettyStr());
    }

    @Test
    void parseString_eachCallBuildsIndependentTree() {
        var first = parser.parseString("[a]\nb = 1");
        var second = parser.parseString("[a]\nb = 1");

        assertNotSame(first, second);
        assertNotSame(first.getFirstChild(), second.getFirstChild());
        assertEquals(first.prettyStr(), second.prettyStr());
    }

    @Test
    void parseString_keepsCommentsOnKeyValues() {
        var file = parser.parseString("# owner of the file\nowner = \"Tom\" # me\n");

        var owner = (TomlKeyValue) file.getFirstChild();
        assertEquals(List.of("# owner of the file"), owner.getComments());
        assertEquals("# me", owner.getInlineComment());
    }

    @Test
    void parseString_emptyDocument() {
        assertFalse(parser.parseString("# nothing here\n").hasChildren());

        var strict = new TomlParser(TomlInputConfig.builder().allowEmptyToml(false).build());
        assertThrows(EmptyTomlException.class, () -> strict.parseString("\n# nothing here\n"));
    }

    @Test
    void parseString_errorsCarryLineNumber() {
        var e = assertThrows(StructuralKindConflictException.class,
                () -> parser.parseString("[a]\nb = 1\n\n[[a.b]]\n"));

        assertEquals(4, e.getLineNo());
        assertTrue(e.getMessage().startsWith("Line 4: "), e.getMessage());
    }

    @Test
    void parseLines_acceptsPreClassifiedLines() {
        var lines = new TomlLineReader().readLines("[[a]]\n[[a]]\n");
        var file = parser.parseLines(lines);

        assertEquals(2, file.getFirstChild().getChildren().size());
    }

    @Test
    void parseString_failedDocumentRaisesParseException() {
        assertThrows(TomlParseException.class, () -> parser.parseString("a = 1\na.b = 2\n"));
    }
}
