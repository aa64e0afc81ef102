package io.reviewdeck.halo.http;

import com.fasterxml.jackson.databind.JsonNode;

public record HaloResponse(int status, JsonNode body, String raw) {

    public boolean ok() {
        return status >= 200 && status < 300;
    }
}
