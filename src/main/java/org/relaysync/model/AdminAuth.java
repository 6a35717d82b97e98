package org.relaysync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Control-plane login. The password is either plaintext (bootstrap, hand edits) or a BCrypt hash.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdminAuth(
        @JsonProperty("username") String username,
        @JsonProperty("password") String password) {

    public static AdminAuth empty() {
        return new AdminAuth("", "");
    }
}
