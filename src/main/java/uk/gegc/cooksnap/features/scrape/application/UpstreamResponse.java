package uk.gegc.cooksnap.features.scrape.application;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * One response from the target host, still holding its connection open.
 */
public interface UpstreamResponse extends Closeable {

    int status();

    Optional<String> header(String name);

    /**
     * Declared body length, or {@code -1} when the server did not declare one.
     */
    long declaredContentLength();

    Optional<String> contentType();

    InputStream body() throws IOException;

    /**
     * Tears the connection down without draining the remaining body.
     */
    void abort();

    @Override
    void close();
}
