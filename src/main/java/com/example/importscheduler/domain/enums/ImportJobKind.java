package com.example.importscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of import requested. Passed through to the processor untouched.
 */
@Getter
@RequiredArgsConstructor
public enum ImportJobKind {

    /**
     * Re-import the whole catalog of the source
     */
    FULL("full", "Full Import"),

    /**
     * Import only what changed since the last synchronization
     */
    DELTA("delta", "Delta Import");

    private final String code;
    private final String displayName;

    public static ImportJobKind fromCode(String code) {
        for (var kind : values()) {
            if (kind.getCode().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown import job kind code: " + code);
    }
}
