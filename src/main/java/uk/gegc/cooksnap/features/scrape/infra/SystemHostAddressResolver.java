package uk.gegc.cooksnap.features.scrape.infra;

import org.springframework.stereotype.Component;
import uk.gegc.cooksnap.features.scrape.application.HostAddressResolver;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves through the JVM resolver, which queries both A and AAAA records and returns
 * whatever either family produced. IP literals are returned as-is without a lookup.
 */
@Component
public class SystemHostAddressResolver implements HostAddressResolver {

    @Override
    public List<InetAddress> resolveAll(String hostname) throws UnknownHostException {
        return Arrays.asList(InetAddress.getAllByName(hostname));
    }
}
