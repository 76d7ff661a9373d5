package com.chainguru.ingestion.fetch;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * System resolver. The port does not influence {@link InetAddress} lookups.
 */
public class DnsHostResolver implements HostResolver {

    @Override
    public List<InetAddress> resolve(String host, int port) throws UnknownHostException {
        return List.of(InetAddress.getAllByName(host));
    }
}
