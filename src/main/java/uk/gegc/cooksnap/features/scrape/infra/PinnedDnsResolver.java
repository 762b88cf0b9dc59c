package uk.gegc.cooksnap.features.scrape.infra;

import org.apache.hc.client5.http.DnsResolver;
import uk.gegc.cooksnap.features.scrape.application.HostGuard;
import uk.gegc.cooksnap.features.scrape.domain.model.ResolvedHost;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * DNS resolver that only knows the one host validated for the current hop and answers with
 * exactly the addresses that passed validation. The HTTP client can therefore never pick up a
 * different answer between validation and connect.
 */
final class PinnedDnsResolver implements DnsResolver {

    private final ResolvedHost pinnedHost;

    PinnedDnsResolver(ResolvedHost pinnedHost) {
        this.pinnedHost = pinnedHost;
    }

    @Override
    public InetAddress[] resolve(String host) throws UnknownHostException {
        if (!pinnedHost.hostname().equals(HostGuard.normalize(host))) {
            throw new UnknownHostException(host + " was not validated for this request");
        }
        return pinnedHost.addressArray();
    }

    @Override
    public String resolveCanonicalHostname(String host) throws UnknownHostException {
        resolve(host);
        return pinnedHost.hostname();
    }
}
