package uk.gegc.cooksnap.features.scrape.application;

import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;

public interface ScrapeService {

    /**
     * Imports a recipe from the URL in {@code requestBody} on behalf of {@code callerId}.
     *
     * @param callerId    authenticated caller, never trusted to be present
     * @param requestBody raw JSON body, expected to look like {@code {"url": "..."}}
     * @return the extracted recipe
     */
    ScrapedRecipe scrape(String callerId, String requestBody);
}
