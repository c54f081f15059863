package org.wordnet.lexical.common.exception;

import javax.annotation.Nullable;

/**
 * Malformed XML or a WN-LMF schema violation. Carries as much position
 * context as the parsing strategy knows: line and column are {@code -1} when
 * unknown, the element path is always set.
 */
public class LmfParseException extends ContainedException {
    private final String element;
    @Nullable
    private final String entityId;
    private final int line;
    private final int column;
    private final String path;

    public LmfParseException(String message, String element, @Nullable String entityId,
                             int line, int column, String path, @Nullable Throwable cause) {
        super(format(message, element, entityId, line, column, path), cause);
        this.element = element;
        this.entityId = entityId;
        this.line = line;
        this.column = column;
        this.path = path;
    }

    public LmfParseException(String message, String element, @Nullable String entityId,
                             int line, int column, String path) {
        this(message, element, entityId, line, column, path, null);
    }

    private static String format(String message, String element, @Nullable String entityId,
                                 int line, int column, String path) {
        StringBuilder b = new StringBuilder(message).append(" [element ").append(element);
        if (entityId != null) {
            b.append(" id=").append(entityId);
        }
        if (line >= 0) {
            b.append(" at line ").append(line).append(", column ").append(column);
        }
        return b.append(" in ").append(path).append(']').toString();
    }

    public String getElement() {
        return element;
    }

    @Nullable
    public String getEntityId() {
        return entityId;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getPath() {
        return path;
    }
}
