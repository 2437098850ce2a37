package toml.exceptions;

public class UnresolvablePathException extends TomlParseException {

    public UnresolvablePathException(String message, int lineNo) {
        super(message, lineNo);
    }
}
