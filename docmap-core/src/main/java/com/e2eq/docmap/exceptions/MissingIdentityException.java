package com.e2eq.docmap.exceptions;

/**
 * Thrown when an entity is about to be persisted but its identifier cannot be resolved,
 * typically because the field the identifier is derived from is still unset.
 */
public class MissingIdentityException extends DocMapException {
    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final String derivingField;

    public MissingIdentityException(String entityType, String derivingField) {
        super(derivingField == null
                ? String.format("Entity %s has no identifier", entityType)
                : String.format("Entity %s has no identifier: deriving field '%s' is not set", entityType, derivingField));
        this.entityType = entityType;
        this.derivingField = derivingField;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getDerivingField() {
        return derivingField;
    }
}
