package io.clusterengine.enums;

/**
 * Outcome of a single policy check.
 *
 * Severity order: OK < WARNING < ERROR < CRITICAL
 */
public enum CheckStatus {
    OK, WARNING, ERROR, CRITICAL;

    public boolean isAtLeast(CheckStatus other) {
        return this.ordinal() >= other.ordinal();
    }

    public CheckStatus merge(CheckStatus other) {
        return this.ordinal() >= other.ordinal() ? this : other;
    }

    public static CheckStatus min(CheckStatus a, CheckStatus b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
