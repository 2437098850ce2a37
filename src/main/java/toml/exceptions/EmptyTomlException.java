package toml.exceptions;

public class EmptyTomlException extends TomlParseException {

    public EmptyTomlException() {
        super("Input contains no tables or key-value pairs, but empty documents are not allowed by the configuration", 0);
    }
}
