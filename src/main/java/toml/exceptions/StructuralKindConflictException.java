package toml.exceptions;

public class StructuralKindConflictException extends TomlParseException {

    public StructuralKindConflictException(String message, int lineNo) {
        super(message, lineNo);
    }
}
