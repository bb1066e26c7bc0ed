package com.fiveminds.core.model;

/**
 * Test counts reported by the implementer for one execution.
 */
public record TestSummary(int passed, int failed, int skipped) {

    public TestSummary {
        if (passed < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException(
                    "Test counts must be non-negative (passed=%d, failed=%d, skipped=%d)"
                            .formatted(passed, failed, skipped));
        }
    }

    public int total() {
        return passed + failed + skipped;
    }

    /**
     * Fraction of tests that passed, or 0 when no tests ran.
     */
    public double passRatio() {
        int total = total();
        return total == 0 ? 0.0 : (double) passed / total;
    }
}
