package uk.gegc.cooksnap.features.scrape.application;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Scheme, port, credential and host rules applied to the submitted URL and to every redirect target.
 */
public final class TargetUrlPolicy {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    private static final Set<Integer> ALLOWED_PORTS = Set.of(80, 443, -1); // -1 means default port

    private TargetUrlPolicy() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns a description of the first rule the URI breaks, or {@code null} when it is acceptable.
     */
    public static String findViolation(URI uri) {
        if (!uri.isAbsolute()) {
            return "URL must be absolute";
        }
        String scheme = uri.getScheme();
        if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            return "Only HTTP and HTTPS schemes are allowed";
        }
        if (uri.getRawUserInfo() != null) {
            return "URL must not contain embedded credentials";
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return "URL must have a valid host";
        }
        if (!isStandardPort(uri)) {
            return "Only standard HTTP ports (80, 443) are allowed";
        }
        return null;
    }

    private static boolean isStandardPort(URI uri) {
        return ALLOWED_PORTS.contains(uri.getPort());
    }
}
