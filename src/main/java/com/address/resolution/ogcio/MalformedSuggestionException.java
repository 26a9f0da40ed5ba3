package com.address.resolution.ogcio;

/**
 * A suggestion returned by the lookup service lacks an expected nested path.
 */
public class MalformedSuggestionException extends RuntimeException {

    private final int rank;

    public MalformedSuggestionException(int rank, String message) {
        super("Suggestion " + rank + ": " + message);
        this.rank = rank;
    }

    /**
     * Position of the offending suggestion in the response.
     */
    public int getRank() {
        return rank;
    }
}
