package com.questrail.assetcodec.api;

/**
 * Thrown when {@link FieldAccess} is asked for a field name the resource does
 * not declare.
 */
public final class UnknownFieldException extends IllegalArgumentException
{
    private final String fieldName;

    public UnknownFieldException(String resourceKind, String fieldName) {
        super("Unknown field '" + fieldName + "' on " + resourceKind);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
