package com.davisodom.settlementsim.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejection surfaced to a command caller.
 *
 * Carries the error code (and through it the {@link ErrorKind}) plus structured detail
 * so the caller can render a precise message, e.g. which resource is short and by how much.
 */
public class SimulationException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public SimulationException(ErrorCode code, String message) {
        this(code, message, Collections.emptyMap(), null);
    }

    public SimulationException(ErrorCode code, String message, Map<String, ?> details) {
        this(code, message, details, null);
    }

    public SimulationException(ErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return code.getKind();
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public static SimulationException notFound(ErrorCode code, Object id) {
        return new SimulationException(code, code.name().toLowerCase().replace('_', ' ') + ": " + id,
                Map.of("id", String.valueOf(id)));
    }

    @Override
    public String toString() {
        return String.format("SimulationException{%s/%s: %s %s}", getKind(), code, getMessage(), details);
    }
}
