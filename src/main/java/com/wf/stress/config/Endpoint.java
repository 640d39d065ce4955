package com.wf.stress.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One target deployment: a list of hosts sharing a single port.
 */
public class Endpoint {

    private final List<String> hosts;
    private final int port;

    public Endpoint(List<String> hosts, int port) {
        if (hosts == null || hosts.isEmpty()) {
            throw new ConfigException("Endpoint must name at least one host");
        }
        this.hosts = List.copyOf(hosts);
        this.port = port;
    }

    public List<String> getHosts() {
        return hosts;
    }

    public int getPort() {
        return port;
    }

    /**
     * Host list in seed-list form, e.g. {@code db1:27017,db2:27017}.
     */
    public String toSeedList() {
        return hosts.stream()
            .map(host -> host + ":" + port)
            .collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return toSeedList();
    }
}
