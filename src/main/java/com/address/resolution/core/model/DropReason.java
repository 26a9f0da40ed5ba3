package com.address.resolution.core.model;

/**
 * Why an input address produced no output record.
 */
public enum DropReason {
    /** Blank or missing input. */
    INVALID_INPUT,
    /** The lookup returned no suggestions, or every attempt failed. */
    NO_SUGGESTIONS,
    /** A suggestion lacked an expected nested path. */
    MALFORMED_SUGGESTION,
    /** Scoring or field extraction failed. */
    SCORING_FAILED
}
