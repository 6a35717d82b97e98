package org.relaysync.engine;

import org.relaysync.model.DeviceGroup;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the address a DNS record should point at out of a device group's connect host,
 * which may hold a hostname, several addresses or free text.
 */
public final class TargetAddress {

    private static final Pattern IPV4_CANDIDATE = Pattern.compile("\\b(?:[0-9]{1,3}\\.){3}[0-9]{1,3}\\b");

    private TargetAddress() {}

    /**
     * @return the first well-formed dotted IPv4 address in {@code connectHost}
     */
    public static Optional<String> firstIpv4(String connectHost) {
        if (connectHost == null || connectHost.isBlank()) {
            return Optional.empty();
        }
        Matcher m = IPV4_CANDIDATE.matcher(connectHost.trim());
        while (m.find()) {
            String candidate = m.group();
            if (isValid(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public static Optional<DeviceGroup> findGroup(List<DeviceGroup> groups, long groupId) {
        if (groups == null) return Optional.empty();
        return groups.stream().filter(g -> g.id() == groupId).findFirst();
    }

    // octets 0-255, no leading zeros
    private static boolean isValid(String candidate) {
        for (String octet : candidate.split("\\.")) {
            if (octet.length() > 1 && octet.charAt(0) == '0') return false;
            if (Integer.parseInt(octet) > 255) return false;
        }
        return true;
    }
}
