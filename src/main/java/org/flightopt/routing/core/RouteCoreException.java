package org.flightopt.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Query-boundary failure with a deterministic reason code.
 *
 * <p>Callers branch on {@link #getReasonCode()}; the message is informational only.
 * {@link RouteCore#REASON_NO_PATH_FOUND} is a valid business outcome (no viable route),
 * while {@link RouteCore#REASON_DISCONNECTED_PATH} signals a caller contract violation.</p>
 */
@Getter
public final class RouteCoreException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RouteCoreException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     */
    public RouteCoreException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
