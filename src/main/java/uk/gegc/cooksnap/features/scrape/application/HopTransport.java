package uk.gegc.cooksnap.features.scrape.application;

import uk.gegc.cooksnap.features.scrape.domain.model.ResolvedHost;

import java.io.IOException;
import java.net.URI;

/**
 * Sends a single GET without following redirects. The connection must only be opened
 * to one of the addresses in {@code pinnedHost}; the transport never resolves names itself.
 */
public interface HopTransport {

    UpstreamResponse send(URI target, ResolvedHost pinnedHost, FetchDeadline deadline) throws IOException;
}
