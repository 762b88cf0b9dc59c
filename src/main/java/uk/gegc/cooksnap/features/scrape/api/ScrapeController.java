package uk.gegc.cooksnap.features.scrape.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.cooksnap.features.scrape.api.dto.ScrapeRequest;
import uk.gegc.cooksnap.features.scrape.application.ScrapeService;
import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;

@RestController
@RequestMapping("/api/v1/scrape")
@RequiredArgsConstructor
@Tag(name = "Recipe Import", description = "Import a recipe from a public web page")
@SecurityRequirement(name = "bearerAuth")
public class ScrapeController {

    private final ScrapeService scrapeService;

    @Operation(
            summary = "Scrape a recipe from a URL",
            description = "Fetches the page server-side, following at most 5 redirects, and extracts recipe data " +
                    "from JSON-LD, microdata or page heuristics. Private and internal addresses are rejected.",
            requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    required = true,
                    content = @Content(schema = @Schema(implementation = ScrapeRequest.class)))
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recipe extracted",
                    content = @Content(schema = @Schema(implementation = ScrapedRecipe.class))),
            @ApiResponse(responseCode = "400", description = "Invalid body, invalid URL or blocked address",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Page missing, not HTML, too large or without recipe data",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many requests from this caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Upstream site failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "504", description = "Upstream site timed out",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ScrapedRecipe> scrape(
            Authentication authentication,
            @RequestBody(required = false) String body
    ) {
        String callerId = authentication != null ? authentication.getName() : null;
        return ResponseEntity.ok(scrapeService.scrape(callerId, body));
    }
}
