package com.chainguru.ingestion.fetch;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * DNS lookup used by the fetch gate. Separate so tests can supply fixed resolutions.
 */
public interface HostResolver {

    /**
     * All addresses the host resolves to for the given port.
     *
     * @throws UnknownHostException if resolution fails
     */
    List<InetAddress> resolve(String host, int port) throws UnknownHostException;
}
