package com.example.access.authz.abac.engine;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * IP address and location allow-lists.
 *
 * <p>IP entries are exact addresses, prefixes ({@code 10.0.} or {@code 10.0.*}) or CIDR
 * blocks for IPv4 and IPv6. Only literal addresses are parsed, host names never trigger a
 * DNS lookup. Location entries are exact (case-insensitive), prefixes ending in {@code *},
 * or a parent region: {@code US} covers {@code US-CA} and {@code US/CA}.
 *
 * <p>An empty allow-list places no restriction. A non-empty list with no value in the
 * request does not match.
 */
@Slf4j
public final class NetworkMatcher {

    private static final Pattern IPV4 =
            Pattern.compile("^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:](?=.*:)[0-9a-fA-F:.]*$");

    public boolean ipAllowed(List<String> allowList, String ipAddress) {
        if (allowList == null || allowList.isEmpty()) {
            return true;
        }
        if (ipAddress == null || ipAddress.isBlank()) {
            return false;
        }
        String ip = ipAddress.trim();
        return allowList.stream().anyMatch(entry -> ipEntryMatches(entry.trim(), ip));
    }

    public boolean locationAllowed(List<String> allowList, String location) {
        if (allowList == null || allowList.isEmpty()) {
            return true;
        }
        if (location == null || location.isBlank()) {
            return false;
        }
        String actual = location.trim().toLowerCase(Locale.ROOT);
        return allowList.stream()
                .map(entry -> entry.trim().toLowerCase(Locale.ROOT))
                .anyMatch(entry -> locationEntryMatches(entry, actual));
    }

    private boolean ipEntryMatches(String entry, String ip) {
        if (entry.isEmpty()) {
            return false;
        }
        if (entry.contains("/")) {
            return inCidr(entry, ip);
        }
        if (entry.endsWith("*")) {
            return ip.startsWith(entry.substring(0, entry.length() - 1));
        }
        if (entry.endsWith(".")) {
            return ip.startsWith(entry);
        }
        return entry.equalsIgnoreCase(ip);
    }

    private static boolean locationEntryMatches(String entry, String location) {
        if (entry.isEmpty()) {
            return false;
        }
        if (entry.endsWith("*")) {
            return location.startsWith(entry.substring(0, entry.length() - 1));
        }
        return location.equals(entry)
                || location.startsWith(entry + "-")
                || location.startsWith(entry + "/");
    }

    boolean inCidr(String cidr, String ip) {
        int slash = cidr.indexOf('/');
        Optional<byte[]> network = parseLiteral(cidr.substring(0, slash));
        Optional<byte[]> address = parseLiteral(ip);
        if (network.isEmpty() || address.isEmpty() || network.get().length != address.get().length) {
            return false;
        }
        int prefix;
        try {
            prefix = Integer.parseInt(cidr.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid CIDR prefix in policy allow-list: {}", cidr);
            return false;
        }
        byte[] net = network.get();
        byte[] addr = address.get();
        if (prefix < 0 || prefix > net.length * 8) {
            return false;
        }
        int fullBytes = prefix / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (net[i] != addr[i]) {
                return false;
            }
        }
        int remainder = prefix % 8;
        if (remainder == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainder)) & 0xFF;
        return (net[fullBytes] & mask) == (addr[fullBytes] & mask);
    }

    static Optional<byte[]> parseLiteral(String value) {
        String text = value.trim();
        if (IPV4.matcher(text).matches()) {
            String[] parts = text.split("\\.");
            byte[] bytes = new byte[4];
            for (int i = 0; i < 4; i++) {
                bytes[i] = (byte) Integer.parseInt(parts[i]);
            }
            return Optional.of(bytes);
        }
        if (IPV6.matcher(text).matches()) {
            // starts with a hex digit or ':' and contains ':', so InetAddress parses it as a literal
            try {
                byte[] bytes = InetAddress.getByName(text).getAddress();
                return Optional.of(bytes);
            } catch (UnknownHostException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
