package io.clusterengine.driver;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Thrown when the driver could not carry out a resource operation.
 */
@Getter
public class DriverException extends Exception {

    private final Map<String, Object> detail;

    public DriverException(String message) {
        this(message, Collections.emptyMap(), null);
    }

    public DriverException(String message, Throwable cause) {
        this(message, Collections.emptyMap(), cause);
    }

    public DriverException(String message, Map<String, Object> detail, Throwable cause) {
        super(message, cause);
        this.detail = detail != null ? detail : Collections.emptyMap();
    }
}
