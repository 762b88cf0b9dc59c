package uk.gegc.cooksnap.features.scrape.domain.model;

import java.net.InetAddress;
import java.util.List;

/**
 * A hostname together with every address it resolved to at validation time.
 * Lives for one hop of one request and is never cached.
 */
public record ResolvedHost(String hostname, List<InetAddress> addresses) {

    public ResolvedHost {
        addresses = List.copyOf(addresses);
    }

    public InetAddress[] addressArray() {
        return addresses.toArray(new InetAddress[0]);
    }
}
