package uk.gegc.cooksnap.features.scrape.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import uk.gegc.cooksnap.features.scrape.domain.ContentTooLargeException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Reads a response body under a hard byte ceiling.
 * <p>
 * A declared length above the ceiling is rejected before reading. The declared length is not
 * trusted otherwise: the body is consumed chunk by chunk and the response is aborted the moment
 * the running total passes the ceiling, so at most ceiling plus one chunk is ever held.
 */
@Slf4j
@Component
public class BoundedBodyReader {

    static final int CHUNK_SIZE = 8192;

    public byte[] readCapped(UpstreamResponse response, long maxBytes) throws IOException {
        long declared = response.declaredContentLength();
        if (declared > maxBytes) {
            log.info("Rejecting response with declared length {} over limit {}", declared, maxBytes);
            response.abort();
            throw new ContentTooLargeException(maxBytes);
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream(
                declared > 0 ? (int) declared : CHUNK_SIZE);
        byte[] chunk = new byte[CHUNK_SIZE];
        long totalBytes = 0;

        try (InputStream inputStream = response.body()) {
            int bytesRead;
            while ((bytesRead = inputStream.read(chunk)) != -1) {
                totalBytes += bytesRead;
                if (totalBytes > maxBytes) {
                    log.info("Aborting body read after {} bytes, limit is {}", totalBytes, maxBytes);
                    response.abort();
                    throw new ContentTooLargeException(maxBytes);
                }
                buffer.write(chunk, 0, bytesRead);
            }
        }
        return buffer.toByteArray();
    }

    /**
     * Decodes a body using the charset parameter of its content type, UTF-8 otherwise.
     */
    public static String decode(byte[] body, String contentType) {
        return new String(body, charsetOf(contentType));
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            Charset charset = MediaType.parseMediaType(contentType).getCharset();
            return charset != null ? charset : StandardCharsets.UTF_8;
        } catch (IllegalArgumentException ex) {
            log.debug("Unusable content type '{}', decoding as UTF-8", contentType);
            return StandardCharsets.UTF_8;
        }
    }
}
