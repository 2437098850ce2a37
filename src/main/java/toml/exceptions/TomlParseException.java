package toml.exceptions;

public class TomlParseException extends RuntimeException {

    private final int lineNo;

    public TomlParseException(String message, int lineNo) {
        super(withLine(message, lineNo));
        this.lineNo = lineNo;
    }

    public int getLineNo() {
        return lineNo;
    }

    private static String withLine(String message, int lineNo) {
        if (lineNo <= 0) {
            return message;
        }
        return "Line " + lineNo + ": " + message;
    }
}
