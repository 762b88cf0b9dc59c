package uk.gegc.cooksnap.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.cooksnap.features.scrape.domain.ContentTooLargeException;
import uk.gegc.cooksnap.features.scrape.domain.FetchTimeoutException;
import uk.gegc.cooksnap.features.scrape.domain.InvalidScrapeRequestException;
import uk.gegc.cooksnap.features.scrape.domain.LinkFetchException;
import uk.gegc.cooksnap.features.scrape.domain.NotHtmlContentException;
import uk.gegc.cooksnap.features.scrape.domain.RecipeNotFoundException;
import uk.gegc.cooksnap.features.scrape.domain.SsrfProtectionException;
import uk.gegc.cooksnap.features.scrape.domain.UpstreamStatusException;
import uk.gegc.cooksnap.shared.api.problem.ErrorTypes;
import uk.gegc.cooksnap.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.cooksnap.shared.exception.RateLimitExceededException;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String SSRF_MESSAGE = "Invalid URL. Requests to private addresses are not allowed.";
    static final String GENERIC_MESSAGE = "Something went wrong while scraping.";

    @ExceptionHandler(InvalidScrapeRequestException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRequest(InvalidScrapeRequestException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_SCRAPE_REQUEST,
                "Invalid Request",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(SsrfProtectionException.class)
    public ResponseEntity<ProblemDetail> handleSsrfBlocked(SsrfProtectionException ex, HttpServletRequest request) {
        // the precise reason names internal hosts and addresses, so it stays in the log
        logger.warn("Blocked outbound fetch: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.SSRF_BLOCKED,
                "URL Not Allowed",
                SSRF_MESSAGE,
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(UpstreamStatusException.class)
    public ResponseEntity<ProblemDetail> handleUpstreamStatus(UpstreamStatusException ex, HttpServletRequest request) {
        logger.info("Upstream responded with status {}", ex.getStatus());
        HttpStatus status;
        ProblemDetail problem;
        switch (ex.getStatus()) {
            case 404 -> {
                status = HttpStatus.UNPROCESSABLE_ENTITY;
                problem = ProblemDetailBuilder.create(status, ErrorTypes.UPSTREAM_NOT_FOUND, "Page Not Found",
                        "Page not found. Please check the URL and try again.", request);
            }
            case 429 -> {
                status = HttpStatus.TOO_MANY_REQUESTS;
                problem = ProblemDetailBuilder.create(status, ErrorTypes.UPSTREAM_RATE_LIMITED, "Upstream Rate Limited",
                        "Rate limited. Please wait a moment and try again.", request);
            }
            case 403 -> {
                status = HttpStatus.FORBIDDEN;
                problem = ProblemDetailBuilder.create(status, ErrorTypes.UPSTREAM_FORBIDDEN, "Upstream Access Denied",
                        "Access denied. The site does not allow scraping.", request);
            }
            default -> {
                status = HttpStatus.BAD_GATEWAY;
                problem = ProblemDetailBuilder.create(status, ErrorTypes.UPSTREAM_UNAVAILABLE, "Upstream Error",
                        "Failed to fetch page (" + ex.getStatus() + ")", request);
            }
        }
        problem.setProperty("upstreamStatus", ex.getStatus());
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(NotHtmlContentException.class)
    public ResponseEntity<ProblemDetail> handleNotHtml(NotHtmlContentException ex, HttpServletRequest request) {
        logger.info("Rejected non-HTML response with content type '{}'", ex.getContentType());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.NOT_HTML,
                "Unsupported Content",
                "The URL did not return an HTML page. Only HTML recipe pages are supported.",
                request
        );
        problem.setProperty("contentType", ex.getContentType());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(ContentTooLargeException.class)
    public ResponseEntity<ProblemDetail> handleContentTooLarge(ContentTooLargeException ex, HttpServletRequest request) {
        long megabytes = Math.max(1, ex.getLimitBytes() / (1024 * 1024));
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.CONTENT_TOO_LARGE,
                "Content Too Large",
                "Response too large (max " + megabytes + " MB).",
                request
        );
        problem.setProperty("limitBytes", ex.getLimitBytes());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(FetchTimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(FetchTimeoutException ex, HttpServletRequest request) {
        logger.warn("Fetch timed out: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.GATEWAY_TIMEOUT,
                ErrorTypes.FETCH_TIMEOUT,
                "Request Timed Out",
                "Request timed out. The site may be slow or unavailable.",
                request
        );
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(problem);
    }

    @ExceptionHandler(RecipeNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleRecipeNotFound(RecipeNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.RECIPE_NOT_FOUND,
                "Recipe Not Found",
                "Could not find recipe data on this page. The site may not use standard recipe markup.",
                request
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(LinkFetchException.class)
    public ResponseEntity<ProblemDetail> handleLinkFetch(LinkFetchException ex, HttpServletRequest request) {
        logger.warn("Fetch failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.UPSTREAM_UNAVAILABLE,
                "Upstream Error",
                "Failed to fetch page. Please try again later.",
                request
        );
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RateLimitExceededException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.TOO_MANY_REQUESTS,
                ErrorTypes.RATE_LIMIT_EXCEEDED,
                "Rate Limit Exceeded",
                ex.getMessage(),
                request
        );
        problem.setProperty("retryAfterSeconds", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(problem);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleAuthentication(AuthenticationException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNAUTHORIZED,
                ErrorTypes.UNAUTHORIZED,
                "Unauthorized",
                "Authentication required.",
                request
        );
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problem);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ACCESS_DENIED,
                "Access Denied",
                "You do not have permission to access this resource",
                request
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                GENERIC_MESSAGE,
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
