package org.relaysync.client.account;

/**
 * A logged-in panel session. The token goes verbatim into the Authorization header.
 */
public record AccountSession(String host, String token) {

    @Override
    public String toString() {
        return "AccountSession[host=" + host + "]";
    }
}
