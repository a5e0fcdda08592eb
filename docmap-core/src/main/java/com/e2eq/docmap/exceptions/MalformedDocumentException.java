package com.e2eq.docmap.exceptions;

/**
 * Thrown when a stored or supplied value does not have the shape a codec expects.
 * Carries the field that failed and a description of the expected shape.
 */
public class MalformedDocumentException extends DocMapException {
    private static final long serialVersionUID = 1L;

    private final String field;
    private final String expectedShape;
    private final transient Object actualValue;

    public MalformedDocumentException(String field, String expectedShape, Object actualValue) {
        super(buildMessage(field, expectedShape, actualValue));
        this.field = field;
        this.expectedShape = expectedShape;
        this.actualValue = actualValue;
    }

    public MalformedDocumentException(String field, String expectedShape, Object actualValue, Throwable cause) {
        super(buildMessage(field, expectedShape, actualValue), cause);
        this.field = field;
        this.expectedShape = expectedShape;
        this.actualValue = actualValue;
    }

    private static String buildMessage(String field, String expectedShape, Object actualValue) {
        String actual = actualValue == null ? "null" : actualValue.getClass().getSimpleName() + " " + actualValue;
        return String.format("Malformed value for field '%s': expected %s but found %s",
                field != null ? field : "<value>", expectedShape, actual);
    }

    public String getField() {
        return field;
    }

    public String getExpectedShape() {
        return expectedShape;
    }

    public Object getActualValue() {
        return actualValue;
    }
}
