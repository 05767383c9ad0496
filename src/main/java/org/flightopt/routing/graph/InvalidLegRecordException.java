package org.flightopt.routing.graph;

import lombok.Getter;

import java.util.Objects;

/**
 * Load-time rejection of a malformed leg record.
 */
@Getter
public final class InvalidLegRecordException extends RuntimeException {
    public static final String REASON_RECORD_REQUIRED = "INVALID_RECORD_NULL";
    public static final String REASON_AIRPORT_REQUIRED = "INVALID_RECORD_AIRPORT_REQUIRED";
    public static final String REASON_FIELD_MISSING = "INVALID_RECORD_FIELD_MISSING";
    public static final String REASON_NON_FINITE_VALUE = "INVALID_RECORD_NON_FINITE_VALUE";
    public static final String REASON_NEGATIVE_VALUE = "INVALID_RECORD_NEGATIVE_VALUE";

    private final String reasonCode;
    /** Zero-based position of the offending record in the input sequence. */
    private final int recordIndex;

    public InvalidLegRecordException(String reasonCode, int recordIndex, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] record " + recordIndex + ": " + message);
        this.reasonCode = reasonCode;
        this.recordIndex = recordIndex;
    }
}
