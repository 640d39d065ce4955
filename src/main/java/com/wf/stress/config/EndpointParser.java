package com.wf.stress.config;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses endpoint address strings of the form {@code host[:port][,host[:port]...]}.
 *
 * <p>All explicit ports within one address string must agree. A mismatch is a
 * configuration error for the whole run, not only for the offending endpoint.
 */
public class EndpointParser {

    public static final int DEFAULT_PORT = 27017;

    private static final Pattern HOST_WITH_PORT = Pattern.compile("([a-zA-Z_0-9.-]+):(\\d+)");
    private static final Pattern HOST_ONLY = Pattern.compile("[a-zA-Z_0-9.-]+");

    private final int defaultPort;

    public EndpointParser() {
        this(DEFAULT_PORT);
    }

    public EndpointParser(int defaultPort) {
        this.defaultPort = defaultPort;
    }

    public List<Endpoint> parseAll(List<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw new ConfigException("At least one endpoint is required");
        }
        List<Endpoint> endpoints = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            endpoints.add(parse(address));
        }
        return endpoints;
    }

    public Endpoint parse(String address) {
        if (address == null || address.isBlank()) {
            throw new ConfigException("Endpoint address is empty");
        }

        List<String> hosts = new ArrayList<>();
        Integer port = null;

        for (String part : address.split(",")) {
            String hostSpec = part.trim();
            Matcher withPort = HOST_WITH_PORT.matcher(hostSpec);

            if (withPort.matches()) {
                int hostPort = parsePort(withPort.group(2), address);
                if (port != null && port != hostPort) {
                    throw new ConfigException("Ports in " + address + " don't match");
                }
                port = hostPort;
                hosts.add(withPort.group(1));
            } else if (HOST_ONLY.matcher(hostSpec).matches()) {
                hosts.add(hostSpec);
            } else {
                throw new ConfigException("Malformed host '" + hostSpec + "' in endpoint " + address);
            }
        }

        return new Endpoint(hosts, port != null ? port : defaultPort);
    }

    private static int parsePort(String digits, String address) {
        try {
            int port = Integer.parseInt(digits);
            if (port < 1 || port > 65535) {
                throw new ConfigException("Port " + port + " out of range in endpoint " + address);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid port in endpoint " + address, e);
        }
    }
}
