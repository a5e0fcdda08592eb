package com.e2eq.docmap.exceptions;

public class UnsavedParentException extends DocMapException {
    private static final long serialVersionUID = 1L;

    private final String parentType;
    private final String relation;

    public UnsavedParentException(String parentType, String relation) {
        super(String.format("Cannot create embedded '%s' because parent %s has not been saved", relation, parentType));
        this.parentType = parentType;
        this.relation = relation;
    }

    public String getParentType() {
        return parentType;
    }

    public String getRelation() {
        return relation;
    }
}
