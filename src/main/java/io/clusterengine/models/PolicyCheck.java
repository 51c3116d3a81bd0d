package io.clusterengine.models;

import io.clusterengine.enums.CheckStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Raw result returned by a policy hook.
 */
@Data
@AllArgsConstructor
public class PolicyCheck {

    private final CheckStatus status;
    private final String reason;

    public static PolicyCheck ok() {
        return new PolicyCheck(CheckStatus.OK, null);
    }

    public static PolicyCheck ok(String reason) {
        return new PolicyCheck(CheckStatus.OK, reason);
    }

    public static PolicyCheck warning(String reason) {
        return new PolicyCheck(CheckStatus.WARNING, reason);
    }

    public static PolicyCheck error(String reason) {
        return new PolicyCheck(CheckStatus.ERROR, reason);
    }

    public static PolicyCheck critical(String reason) {
        return new PolicyCheck(CheckStatus.CRITICAL, reason);
    }
}
