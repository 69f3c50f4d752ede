package com.bpmntool.autolayout;

/**
 * A structural finding about a diagram model.
 */
public class ValidationWarning {

    public enum Level {
        ERROR,
        WARNING,
        INFO
    }

    private final Level level;
    private final String elementId;
    private final String message;

    /**
     * @param elementId offending shape or connector, null for model-wide findings
     */
    public ValidationWarning(Level level, String elementId, String message) {
        this.level = level;
        this.elementId = elementId;
        this.message = message;
    }

    public Level getLevel() {
        return level;
    }

    public String getElementId() {
        return elementId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return level + ": " + message;
    }
}
