package com.bpmntool.autolayout;

/**
 * Raised when a layout computation cannot produce positions.
 */
public class LayoutException extends Exception {

    private static final long serialVersionUID = 1L;

    public LayoutException(String message) {
        super(message);
    }

    public LayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
