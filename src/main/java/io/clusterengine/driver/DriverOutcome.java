package io.clusterengine.driver;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Result of one driver call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverOutcome {

    private boolean success;

    private String message;

    // Driver-specific data, e.g. "healthy" for check operations
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    public static DriverOutcome ok() {
        return DriverOutcome.builder().success(true).build();
    }

    public static DriverOutcome ok(Map<String, Object> data) {
        return DriverOutcome.builder().success(true).data(data).build();
    }

    public static DriverOutcome failed(String message) {
        return DriverOutcome.builder().success(false).message(message).build();
    }
}
