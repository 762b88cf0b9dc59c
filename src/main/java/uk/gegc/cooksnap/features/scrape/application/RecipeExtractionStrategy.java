package uk.gegc.cooksnap.features.scrape.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;

import java.util.Optional;

/**
 * Extracts from the statically fetched HTML first and only pays for a headless render when that
 * finds nothing. The rendered page is extracted exactly once more; a failing render is treated
 * as "no recipe", never as an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipeExtractionStrategy {

    private final RecipeExtractor recipeExtractor;
    private final RenderFallback renderFallback;

    public Optional<ScrapedRecipe> extractRecipe(String html, String sourceUrl) {
        Optional<ScrapedRecipe> recipe = recipeExtractor.extract(html, sourceUrl);
        if (recipe.isPresent()) {
            return recipe;
        }

        log.info("No recipe in static HTML for {}, trying rendered page", sourceUrl);
        Optional<String> renderedHtml;
        try {
            renderedHtml = renderFallback.render(sourceUrl);
        } catch (RuntimeException ex) {
            log.warn("Render fallback failed for {}: {}", sourceUrl, ex.getMessage());
            return Optional.empty();
        }
        if (renderedHtml == null || renderedHtml.isEmpty()) {
            return Optional.empty();
        }
        return recipeExtractor.extract(renderedHtml.get(), sourceUrl);
    }
}
