package com.vcc.admission.model;

/**
 * Identity of a window counter: one live counter per (scope, subject).
 */
public record WindowKey(LayerScope scope, String subject) {

    public WindowKey {
        if (scope == null) {
            throw new IllegalArgumentException("scope is required");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
    }

    public String asString() {
        return scope.code() + ":" + subject;
    }
}
