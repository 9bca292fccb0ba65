package org.tobmap.routing.build;

import lombok.Getter;

/**
 * Build input rejected before any graph is produced. Carries a deterministic reason code and the
 * external id of the offending record.
 */
@Getter
public final class MalformedInputException extends RuntimeException {
    public static final String REASON_TOO_FEW_POINTS = "BUILD_WAY_TOO_FEW_POINTS";
    public static final String REASON_INVALID_COORDINATE = "BUILD_INVALID_COORDINATE";
    public static final String REASON_INVALID_PRIORITY = "BUILD_INVALID_PRIORITY";
    public static final String REASON_DUPLICATE_NODE = "BUILD_DUPLICATE_NODE";
    public static final String REASON_MISSING_NODE = "BUILD_MISSING_NODE";
    public static final String REASON_DUPLICATE_WAY = "BUILD_DUPLICATE_WAY";

    private final String reasonCode;
    private final long recordId;

    public MalformedInputException(String reasonCode, long recordId, String message) {
        super("[" + reasonCode + "] record " + recordId + ": " + message);
        this.reasonCode = reasonCode;
        this.recordId = recordId;
    }
}
