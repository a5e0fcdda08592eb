package com.e2eq.docmap.exceptions;

import com.e2eq.docmap.validation.ValidationViolation;

import java.util.List;

public class DocumentValidationException extends DocMapException {
    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final List<ValidationViolation> violations;

    public DocumentValidationException(String entityType, List<ValidationViolation> violations) {
        super();
        this.entityType = entityType;
        this.violations = List.copyOf(violations);
    }

    public String getEntityType() {
        return entityType;
    }

    public List<ValidationViolation> getViolations() {
        return violations;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder("Validation failed for ").append(entityType);
        for (ValidationViolation violation : violations) {
            sb.append("\n").append(violation.getField()).append(" : ").append(violation.getMessage());
        }
        return sb.toString();
    }
}
