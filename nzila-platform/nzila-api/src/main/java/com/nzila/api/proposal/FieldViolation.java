package com.nzila.api.proposal;

/**
 * A single offending field in a rejected proposal.
 */
public record FieldViolation(String field, String code, String message) {

    public static final String REQUIRED = "REQUIRED";
    public static final String INVALID_TYPE = "INVALID_TYPE";
    public static final String INVALID_FORMAT = "INVALID_FORMAT";
    public static final String OUT_OF_RANGE = "OUT_OF_RANGE";
    public static final String TOO_LONG = "TOO_LONG";
    public static final String NOT_ALLOWED = "NOT_ALLOWED";
    public static final String UNKNOWN_FIELD = "UNKNOWN_FIELD";
    public static final String CONSTRAINT = "CONSTRAINT";
}
