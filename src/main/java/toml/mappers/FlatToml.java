package toml.mappers;

import org.apache.commons.lang3.NotImplementedException;
import org.apache.commons.lang3.StringUtils;
import toml.exceptions.StructuralKindConflictException;
import toml.parser.TomlParser;
import toml.tree.KeyPath;
import toml.tree.NodeKind;
import toml.tree.TomlFile;
import toml.tree.TomlKeyValue;
import toml.tree.TomlNode;
import toml.tree.TomlTable;
import toml.tree.TomlValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

public class FlatToml implements FlatService {

    private final TomlParser parser;

    public FlatToml() {
        this(new TomlParser());
    }

    public FlatToml(TomlParser parser) {
        this.parser = parser;
    }

    @Override
    public Map<String, FileDataItem> flatToMap(String data) {
        Map<String, FileDataItem> flatData = new LinkedHashMap<>();
        if (data == null || data.isBlank()) {
            return flatData;
        }

        TomlFile file = parser.parseString(data);
        flatten(flatData, file, "");
        return flatData;
    }

    @Override
    public String flatToString(Map<String, FileDataItem> data) {
        throw new NotImplementedException("Writing .toml files is not supported.");
    }

    @Override
    public void validate(Map<String, FileDataItem> data) {
        if (data == null || data.isEmpty()) {
            return;
        }

        NavigableSet<String> keys = new TreeSet<>();
        for (Map.Entry<String, FileDataItem> entry : data.entrySet()) {
            String key = entry.getKey();
            FileDataItem item = entry.getValue();
            if (StringUtils.isBlank(key)) {
                throw new IllegalArgumentException("Flat key must not be blank");
            }
            if (item == null || !key.equals(item.getKey())) {
                throw new IllegalArgumentException("Item stored under <" + key + "> has key <"
                        + (item == null ? null : item.getKey()) + ">");
            }
            keys.add(key);
        }

        for (String key : keys) {
            String nested = firstWithPrefix(keys, key + ".");
            if (nested == null) {
                nested = firstWithPrefix(keys, key + "[");
            }
            if (nested != null) {
                throw new StructuralKindConflictException(
                        "Key <" + key + "> holds a value but <" + nested + "> uses it as a table or array",
                        data.get(key).getLineNo());
            }
        }
    }

    private static String firstWithPrefix(NavigableSet<String> keys, String prefix) {
        String candidate = keys.ceiling(prefix);
        return candidate != null && candidate.startsWith(prefix) ? candidate : null;
    }

    private void flatten(Map<String, FileDataItem> result, TomlNode node, String parentKey) {
        for (TomlNode child : node.getChildren()) {
            NodeKind kind = child.getKind();
            if (kind == NodeKind.TABLE) {
                processTable(result, (TomlTable) child, parentKey);
            } else if (kind == NodeKind.KEY_VALUE_PRIMITIVE || kind == NodeKind.KEY_VALUE_ARRAY) {
                TomlKeyValue keyValue = (TomlKeyValue) child;
                String key = childKey(parentKey, keyValue.getName());
                addValue(result, key, parentKey, keyValue.getValue(), keyValue.getLineNo(), commentOf(keyValue));
            } else if (kind == NodeKind.STUB) {
                put(result, parentKey, parentKey, "", child.getLineNo(), null);
            }
        }
    }

    private void processTable(Map<String, FileDataItem> result, TomlTable table, String parentKey) {
        String key = childKey(parentKey, table.getName());
        if (!table.isArray()) {
            flatten(result, table, key);
            return;
        }
        List<TomlNode> elements = table.getChildren();
        for (int i = 0; i < elements.size(); i++) {
            flatten(result, elements.get(i), key + "[" + i + "]");
        }
    }

    private void addValue(Map<String, FileDataItem> result,
                          String key,
                          String path,
                          TomlValue value,
                          int lineNo,
                          String comment) {
        if (value.getType() == TomlValue.Type.ARRAY) {
            List<TomlValue> elements = value.getElements();
            if (elements.isEmpty()) {
                put(result, key, path, "", lineNo, comment);
            }
            for (int i = 0; i < elements.size(); i++) {
                addValue(result, key + "[" + i + "]", path, elements.get(i), lineNo, i == 0 ? comment : null);
            }
        } else if (value.getType() == TomlValue.Type.INLINE_TABLE) {
            List<TomlValue.Entry> entries = value.getEntries();
            if (entries.isEmpty()) {
                put(result, key, path, "", lineNo, comment);
            }
            for (int i = 0; i < entries.size(); i++) {
                TomlValue.Entry entry = entries.get(i);
                addValue(result, key + "." + entry.getKey(), key, entry.getValue(), lineNo, i == 0 ? comment : null);
            }
        } else {
            put(result, key, path, value.getRaw(), lineNo, comment);
        }
    }

    private static void put(Map<String, FileDataItem> result,
                            String key,
                            String path,
                            Object value,
                            int lineNo,
                            String comment) {
        FileDataItem item = FileDataItem.builder()
                .key(key)
                .path(path)
                .value(value)
                .lineNo(lineNo)
                .comment(comment)
                .build();
        result.put(key, item);
    }

    private static String childKey(String parentKey, String name) {
        String segment = KeyPath.quoteSegment(name);
        return parentKey.isEmpty() ? segment : parentKey + "." + segment;
    }

    private static String commentOf(TomlKeyValue keyValue) {
        List<String> lines = new ArrayList<>(keyValue.getComments());
        if (keyValue.getInlineComment() != null) {
            lines.add(keyValue.getInlineComment());
        }
        return lines.isEmpty() ? null : String.join("\n", lines);
    }
}
