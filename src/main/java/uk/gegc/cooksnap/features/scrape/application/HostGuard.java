package uk.gegc.cooksnap.features.scrape.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import uk.gegc.cooksnap.features.scrape.domain.FetchTimeoutException;
import uk.gegc.cooksnap.features.scrape.domain.LinkFetchException;
import uk.gegc.cooksnap.features.scrape.domain.SsrfProtectionException;
import uk.gegc.cooksnap.features.scrape.domain.model.ResolvedHost;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a hostname and rejects it when it cannot be resolved or when any of its
 * addresses is blocked. A host answering with a mix of public and private addresses
 * is rejected as a whole, since the attacker controls which answer is used.
 * <p>
 * Lookups run on {@code dnsLookupExecutor} so a slow authoritative server costs at most the
 * time left on the fetch deadline. The JVM resolver cannot be interrupted, so an abandoned
 * lookup keeps its pool thread until the resolver gives up on its own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HostGuard {

    private final HostAddressResolver resolver;
    private final AddressClassifier addressClassifier;
    private final AsyncTaskExecutor dnsLookupExecutor;

    public ResolvedHost guard(String host, FetchDeadline deadline) {
        String hostname = normalize(host);
        if (hostname.isEmpty()) {
            throw new SsrfProtectionException("URL must have a valid host");
        }

        List<InetAddress> addresses = resolve(hostname, deadline);
        if (addresses == null || addresses.isEmpty()) {
            throw new SsrfProtectionException("Cannot resolve host: " + hostname);
        }

        for (InetAddress address : addresses) {
            if (addressClassifier.isBlocked(address)) {
                throw new SsrfProtectionException(
                        "Host " + hostname + " resolves to blocked address " + address.getHostAddress());
            }
        }
        return new ResolvedHost(hostname, addresses);
    }

    private List<InetAddress> resolve(String hostname, FetchDeadline deadline) {
        Duration remaining = deadline.remaining();

        Future<List<InetAddress>> lookup;
        try {
            lookup = dnsLookupExecutor.submit(() -> resolver.resolveAll(hostname));
        } catch (TaskRejectedException ex) {
            throw new LinkFetchException("No capacity to resolve host: " + hostname, ex);
        }

        try {
            return lookup.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            lookup.cancel(true);
            log.info("DNS lookup for {} did not finish within {} ms", hostname, remaining.toMillis());
            throw new FetchTimeoutException("Timed out resolving host: " + hostname, ex);
        } catch (InterruptedException ex) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            throw new FetchTimeoutException("Interrupted while resolving host: " + hostname, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof UnknownHostException) {
                throw new SsrfProtectionException("Cannot resolve host: " + hostname, cause);
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new LinkFetchException("Failed to resolve host: " + hostname, cause);
        }
    }

    public static String normalize(String host) {
        if (host == null) {
            return "";
        }
        String hostname = host.trim().toLowerCase(Locale.ROOT);
        if (hostname.startsWith("[") && hostname.endsWith("]")) {
            hostname = hostname.substring(1, hostname.length() - 1);
        }
        if (hostname.endsWith(".")) {
            hostname = hostname.substring(0, hostname.length() - 1);
        }
        return hostname;
    }
}
