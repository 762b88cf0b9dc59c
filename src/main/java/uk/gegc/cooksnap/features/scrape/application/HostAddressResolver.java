package uk.gegc.cooksnap.features.scrape.application;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Name resolution seam used by {@link HostGuard}. Implementations return every A and AAAA
 * answer for the host; a host with answers in only one family is not an error.
 */
public interface HostAddressResolver {

    List<InetAddress> resolveAll(String hostname) throws UnknownHostException;
}
