package com.residencecare.backend.modules.history.domain;

public enum ChangeKind {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String label;

    ChangeKind(String label) {
        this.label = label;
    }

    /**
     * Action label used for the matching event-log row.
     */
    public String label() {
        return label;
    }
}
