package com.identity.resolution.env;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Supplies the local host name.
 */
@FunctionalInterface
public interface HostnameSource {

    /**
     * @throws IOException if the host name cannot be determined
     */
    String hostname() throws IOException;

    /**
     * The local host name as reported by {@link InetAddress#getLocalHost()}.
     */
    static HostnameSource local() {
        return () -> InetAddress.getLocalHost().getHostName();
    }
}
