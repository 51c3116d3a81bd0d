package io.clusterengine.enums;

/**
 * Per-binding enforcement level applied to a policy's raw check result.
 *
 * IGNORE: every result becomes OK.
 * WARNING: every non-OK result becomes WARNING.
 * ERROR: results are capped at ERROR, so the binding never stops evaluation.
 * CRITICAL: ERROR and CRITICAL results become CRITICAL, WARNING stays WARNING.
 */
public enum EnforcementLevel {
    CRITICAL, ERROR, WARNING, IGNORE;

    public CheckStatus apply(CheckStatus raw) {
        if (raw == CheckStatus.OK) {
            return CheckStatus.OK;
        }
        switch (this) {
            case IGNORE:
                return CheckStatus.OK;
            case WARNING:
                return CheckStatus.WARNING;
            case ERROR:
                return CheckStatus.min(raw, CheckStatus.ERROR);
            case CRITICAL:
            default:
                return raw.isAtLeast(CheckStatus.ERROR) ? CheckStatus.CRITICAL : raw;
        }
    }

    public static EnforcementLevel fromString(String value) {
        if (value == null) return null;
        try {
            return EnforcementLevel.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
