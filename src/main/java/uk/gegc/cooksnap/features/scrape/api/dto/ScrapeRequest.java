package uk.gegc.cooksnap.features.scrape.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ScrapeRequest", description = "Page to import a recipe from")
public record ScrapeRequest(
        @Schema(description = "Absolute http(s) URL on port 80 or 443",
                example = "https://www.example.com/recipes/pancakes",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String url
) {
}
