package com.aurelius.core.gate;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * A product-gate check that runs after CRV verification.
 */
public interface ProductCheck {

    String getName();

    Outcome evaluate(Path outputDir);

    final class Outcome {
        private final boolean passed;
        private final String error;
        private final JsonNode detail;

        private Outcome(boolean passed, String error, JsonNode detail) {
            this.passed = passed;
            this.error = error;
            this.detail = detail;
        }

        public static Outcome pass(JsonNode detail) {
            return new Outcome(true, null, detail);
        }

        public static Outcome fail(String error, JsonNode detail) {
            return new Outcome(false, error, detail);
        }

        public boolean isPassed()   { return passed; }
        public String getError()    { return error; }
        public JsonNode getDetail() { return detail; }
    }
}
