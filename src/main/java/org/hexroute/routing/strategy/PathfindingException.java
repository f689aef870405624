package org.hexroute.routing.strategy;

import lombok.Getter;

import java.util.Objects;

/**
 * Reason-coded failure raised by strategies and the search coordinator.
 *
 * <p>Raised for configuration and programming errors and for unexpected search faults.
 * Expected outcomes (unreachable endpoints, no path, cancellation) are reported through
 * {@link SearchResult} instead. Every reason code lives in the {@value #REASON_PREFIX}
 * namespace so log filters can tell hex routing failures apart from host errors.</p>
 */
@Getter
public final class PathfindingException extends RuntimeException {
    /** Namespace shared by every pathfinding reason code. */
    public static final String REASON_PREFIX = "HEX_";

    private final String reasonCode;

    /**
     * Creates a reason-coded pathfinding failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PathfindingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded pathfinding failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public PathfindingException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /** Renders {@code [CODE] message}; the code prefix keeps messages grep-stable. */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Rejects null, blank and out-of-namespace codes.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        if (!code.startsWith(REASON_PREFIX) || code.length() == REASON_PREFIX.length()) {
            throw new IllegalArgumentException("reasonCode must start with " + REASON_PREFIX + ": " + code);
        }
        return code;
    }
}
