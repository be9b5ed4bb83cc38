package com.linetrace.instrument;

/**
 * What the instrumenter does with a statement form it cannot rewrite.
 */
public enum UnsupportedConstructPolicy {
    /** Reject the whole method. */
    FAIL,
    /** Warn, and record the construct as one opaque statement. */
    PASS_THROUGH;

    /** Accepts {@code fail} or {@code pass} (case-insensitive); anything else is FAIL. */
    public static UnsupportedConstructPolicy parse(String value) {
        if (value != null && value.trim().equalsIgnoreCase("pass")) {
            return PASS_THROUGH;
        }
        return FAIL;
    }
}
