package uk.gegc.cooksnap.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://cooksnap.app/docs/errors";

    // ==================== Request Errors ====================
    public static final URI INVALID_SCRAPE_REQUEST = URI.create(BASE_URL + "/invalid-scrape-request");
    public static final URI SSRF_BLOCKED = URI.create(BASE_URL + "/ssrf-blocked");

    // ==================== Upstream Errors ====================
    public static final URI UPSTREAM_NOT_FOUND = URI.create(BASE_URL + "/upstream-not-found");
    public static final URI UPSTREAM_FORBIDDEN = URI.create(BASE_URL + "/upstream-forbidden");
    public static final URI UPSTREAM_RATE_LIMITED = URI.create(BASE_URL + "/upstream-rate-limited");
    public static final URI UPSTREAM_UNAVAILABLE = URI.create(BASE_URL + "/upstream-unavailable");
    public static final URI FETCH_TIMEOUT = URI.create(BASE_URL + "/fetch-timeout");

    // ==================== Content Errors ====================
    public static final URI NOT_HTML = URI.create(BASE_URL + "/not-html");
    public static final URI CONTENT_TOO_LARGE = URI.create(BASE_URL + "/content-too-large");
    public static final URI RECIPE_NOT_FOUND = URI.create(BASE_URL + "/recipe-not-found");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
