package org.tobmap.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Rejected route or snap query. {@link #getReasonCode()} is one of the {@code REASON_*}
 * constants of {@link RouteCore} or {@link DijkstraRoutePlanner}; the message carries the
 * same code in brackets followed by the offending value.
 */
@Getter
public final class RouteCoreException extends RuntimeException {
    private final String reasonCode;

    public RouteCoreException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    public RouteCoreException(String reasonCode, String message, Throwable cause) {
        super(prefixed(reasonCode, message), cause);
        this.reasonCode = reasonCode;
    }

    private static String prefixed(String reasonCode, String message) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return String.format("[%s] %s", reasonCode, Objects.requireNonNull(message, "message"));
    }
}
