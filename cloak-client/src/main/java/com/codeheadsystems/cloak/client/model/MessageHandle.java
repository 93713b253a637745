package com.codeheadsystems.cloak.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the transport returns once a message has been accepted.
 *
 * @param messageId transport-assigned identifier, opaque to this library
 * @param date      server timestamp in epoch seconds
 */
public record MessageHandle(
    @JsonProperty("messageId") String messageId,
    @JsonProperty("date") long date) {
}
