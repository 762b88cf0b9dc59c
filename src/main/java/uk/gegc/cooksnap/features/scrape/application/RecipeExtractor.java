package uk.gegc.cooksnap.features.scrape.application;

import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;

import java.util.Optional;

/**
 * Turns page markup into recipe data. Pure with respect to the network.
 */
public interface RecipeExtractor {

    Optional<ScrapedRecipe> extract(String html, String sourceUrl);
}
