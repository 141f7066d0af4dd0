package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.catalogue.FilterKind;

/**
 * A backend was asked for a kind it has no implementation for.
 * This is a wiring defect, not a runtime condition.
 */
public class UnsupportedFilterKindException extends IllegalStateException {

    private final FilterKind kind;

    public UnsupportedFilterKindException(FilterKind kind, String backend) {
        super("Backend '" + backend + "' does not support " + kind);
        this.kind = kind;
    }

    public FilterKind getKind() {
        return kind;
    }
}
