package uk.gegc.cooksnap.features.scrape.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.util.Timeout;
import org.springframework.stereotype.Component;
import uk.gegc.cooksnap.features.scrape.application.FetchDeadline;
import uk.gegc.cooksnap.features.scrape.application.HopTransport;
import uk.gegc.cooksnap.features.scrape.application.UpstreamResponse;
import uk.gegc.cooksnap.features.scrape.config.LinkFetchConfig;
import uk.gegc.cooksnap.features.scrape.domain.model.ResolvedHost;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Apache HttpClient transport for a single hop.
 * <p>
 * Each hop gets its own client whose DNS resolver is pinned to the addresses validated for that
 * hop. Redirect handling, cookies, auth caching, retries and system proxies are all off. Connect
 * and socket timeouts are clamped to the time left on the shared deadline, and the request is
 * cancelled when the deadline fires.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApacheHopTransport implements HopTransport {

    private final LinkFetchConfig config;

    @Override
    public UpstreamResponse send(URI target, ResolvedHost pinnedHost, FetchDeadline deadline) throws IOException {
        Duration remaining = deadline.remaining();
        Timeout timeout = Timeout.ofMilliseconds(Math.max(1L, remaining.toMillis()));

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDnsResolver(new PinnedDnsResolver(pinnedHost))
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(timeout)
                        .setSocketTimeout(timeout)
                        .build())
                .build();

        CloseableHttpClient client = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setRedirectsEnabled(false)
                        .setConnectionRequestTimeout(timeout)
                        .setResponseTimeout(timeout)
                        .build())
                .disableRedirectHandling()
                .disableCookieManagement()
                .disableAuthCaching()
                .disableAutomaticRetries()
                .setUserAgent(config.getUserAgent())
                .build();

        HttpGet request = new HttpGet(target);
        request.setHeader(HttpHeaders.ACCEPT, config.getAccept());
        deadline.onExpiry(request::cancel);

        try {
            ClassicHttpResponse response = client.executeOpen(null, request, null);
            return new ApacheUpstreamResponse(client, request, response);
        } catch (IOException | RuntimeException ex) {
            request.cancel();
            closeQuietly(client);
            throw ex;
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException ex) {
            log.debug("Ignoring failure while releasing connection: {}", ex.getMessage());
        }
    }

    static final class ApacheUpstreamResponse implements UpstreamResponse {

        private final CloseableHttpClient client;
        private final HttpGet request;
        private final ClassicHttpResponse response;

        ApacheUpstreamResponse(CloseableHttpClient client, HttpGet request, ClassicHttpResponse response) {
            this.client = client;
            this.request = request;
            this.response = response;
        }

        @Override
        public int status() {
            return response.getCode();
        }

        @Override
        public Optional<String> header(String name) {
            Header header = response.getFirstHeader(name);
            return Optional.ofNullable(header).map(Header::getValue);
        }

        @Override
        public long declaredContentLength() {
            HttpEntity entity = response.getEntity();
            return entity == null ? -1 : entity.getContentLength();
        }

        @Override
        public Optional<String> contentType() {
            return header(HttpHeaders.CONTENT_TYPE);
        }

        @Override
        public InputStream body() throws IOException {
            HttpEntity entity = response.getEntity();
            return entity == null ? InputStream.nullInputStream() : entity.getContent();
        }

        @Override
        public void abort() {
            close();
        }

        @Override
        public void close() {
            // cancel first so closing never drains the remaining body
            request.cancel();
            closeQuietly(response);
            closeQuietly(client);
        }
    }
}
