package com.aurelius.core.reflexion;

/**
 * Classification of a failed gate verdict. Each type implies a repair
 * strategy and a stage to resume from.
 */
public enum FailureType {
    TEST_FAILURE("test_failure"),
    DETERMINISM_FAILURE("determinism_failure"),
    LINT_FAILURE("lint_failure"),
    CRV_FAILURE("crv_failure"),
    UNKNOWN("unknown");

    private final String code;

    FailureType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
