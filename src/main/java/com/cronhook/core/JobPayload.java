package com.cronhook.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound notification sent on every firing: a POST of {@code body} to {@code url}.
 */
public record JobPayload(String url, @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode body) {
}
