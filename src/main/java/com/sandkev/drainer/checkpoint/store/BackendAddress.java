package com.sandkev.drainer.checkpoint.store;

import java.util.ArrayList;
import java.util.List;

/** One {@code host:port} entry of the configured backend address list. */
public record BackendAddress(String host, int port) {

    /**
     * Parse {@code "h1[:p1],h2[:p2]"}; entries without a port get {@code defaultPort}.
     *
     * @throws IllegalArgumentException on an empty list, empty host or bad port
     */
    public static List<BackendAddress> parse(String hosts, int defaultPort) {
        if (hosts == null || hosts.isBlank()) {
            throw new IllegalArgumentException("Backend host list is empty");
        }
        List<BackendAddress> out = new ArrayList<>();
        for (String raw : hosts.split(",")) {
            String entry = raw.trim();
            int colon = entry.lastIndexOf(':');
            String host = colon < 0 ? entry : entry.substring(0, colon).trim();
            int port = colon < 0 ? defaultPort : port(entry.substring(colon + 1).trim(), hosts);
            if (host.isEmpty()) throw new IllegalArgumentException("Malformed backend address '" + hosts + "': empty host");
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Malformed backend address '" + hosts + "': port " + port + " out of range");
            }
            out.add(new BackendAddress(host, port));
        }
        return out;
    }

    private static int port(String s, String hosts) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed backend address '" + hosts + "': bad port '" + s + "'", e);
        }
    }
}
