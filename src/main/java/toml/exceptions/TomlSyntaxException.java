package toml.exceptions;

public class TomlSyntaxException extends TomlParseException {

    public TomlSyntaxException(String message, int lineNo) {
        super(message, lineNo);
    }
}
