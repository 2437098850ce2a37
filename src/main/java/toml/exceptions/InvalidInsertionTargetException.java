package toml.exceptions;

public class InvalidInsertionTargetException extends TomlParseException {

    public InvalidInsertionTargetException(String message, int lineNo) {
        super(message, lineNo);
    }
}
