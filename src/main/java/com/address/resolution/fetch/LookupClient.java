package com.address.resolution.fetch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client for the address lookup service.
 */
public interface LookupClient {

    /**
     * Sends one query and returns the parsed response body.
     *
     * @param query the (normalized) address to look up
     * @return the JSON document returned by the service
     * @throws LookupException if the call fails or the body cannot be parsed
     */
    JsonNode lookup(String query) throws LookupException;
}
