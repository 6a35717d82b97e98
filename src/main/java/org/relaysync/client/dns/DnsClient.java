package org.relaysync.client.dns;

import org.relaysync.client.ClientException;

import java.util.Optional;

/**
 * Single-record access to a DNS provider. Only {@code A} records are handled.
 */
public interface DnsClient {

    /**
     * @return the id of the zone named exactly {@code zoneName}, empty if the token sees no such zone
     */
    Optional<String> findZoneId(String token, String zoneName) throws ClientException;

    /**
     * @return the {@code A} record named exactly {@code name}, empty if there is none
     */
    Optional<DnsRecord> findRecord(String token, String zoneId, String name) throws ClientException;

    /**
     * Points {@code record} at {@code content}. Other record attributes are kept.
     */
    DnsRecord updateRecord(String token, String zoneId, DnsRecord record, String content, int ttl) throws ClientException;
}
