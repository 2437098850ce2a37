package toml.tree;

import java.util.Collections;
import java.util.List;

public abstract class TomlKeyValue extends TomlNode {

    private final TomlValue value;
    private final List<String> comments;
    private final String inlineComment;

    protected TomlKeyValue(String key, TomlValue value, int lineNo, List<String> comments, String inlineComment) {
        super(key, lineNo);
        this.value = value;
        this.comments = comments == null ? Collections.emptyList() : Collections.unmodifiableList(comments);
        this.inlineComment = inlineComment;
    }

    public TomlValue getValue() {
        return value;
    }

    public boolean isNull() {
        return value.isNull();
    }

    public List<String> getComments() {
        return comments;
    }

    public String getInlineComment() {
        return inlineComment;
    }

    @Override
    protected boolean isPathSegment() {
        return true;
    }

    @Override
    protected String describe() {
        return getClass().getSimpleName() + " (" + KeyPath.quoteSegment(getName()) + "=" + value + ")";
    }
}
