package toml.parser;

import lombok.extern.slf4j.Slf4j;
import toml.exceptions.EmptyTomlException;
import toml.tree.TomlFile;

import java.util.List;

@Slf4j
public class TomlParser {

    private final TomlInputConfig config;

    public TomlParser() {
        this(TomlInputConfig.defaults());
    }

    public TomlParser(TomlInputConfig config) {
        this.config = config;
    }

    public TomlInputConfig getConfig() {
        return config;
    }

    public TomlFile parseString(String toml) {
        return parseLines(new TomlLineReader(config).readLines(toml));
    }

    public TomlFile parseLines(List<TomlLine> lines) {
        if (lines.isEmpty() && !config.isAllowEmptyToml()) {
            throw new EmptyTomlException();
        }
        TomlTreeBuilder builder = new TomlTreeBuilder();
        for (TomlLine line : lines) {
            builder.accept(line);
        }
        TomlFile file = builder.finish();
        log.debug("Parsed {} structural lines into {} top-level nodes", lines.size(), file.getChildren().size());
        return file;
    }
}
