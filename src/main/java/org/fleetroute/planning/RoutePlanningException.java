package org.fleetroute.planning;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Planner input or configuration that cannot be searched.
 *
 * <p>The message reads {@code [REASON_CODE] detail}. Callers branch on
 * {@link #reasonCode()}; {@link #detail()} is the bare human-readable part.
 * Failures inside one fitness evaluation never surface here, they score as unfit.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RoutePlanningException extends RuntimeException {
    private final String reasonCode;
    private final String detail;

    public RoutePlanningException(String reasonCode, String detail) {
        this(reasonCode, detail, null);
    }

    public RoutePlanningException(String reasonCode, String detail, Throwable cause) {
        super(prefixed(reasonCode, detail), cause);
        this.reasonCode = reasonCode;
        this.detail = detail;
    }

    // Validates both parts before super() stores the message.
    private static String prefixed(String reasonCode, String detail) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        Objects.requireNonNull(detail, "detail");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + detail;
    }
}
