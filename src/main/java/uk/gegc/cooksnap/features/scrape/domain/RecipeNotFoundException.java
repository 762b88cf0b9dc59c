package uk.gegc.cooksnap.features.scrape.domain;

/**
 * Thrown when neither the static nor the rendered page yields recipe data.
 * An expected outcome for unsupported pages.
 */
public class RecipeNotFoundException extends LinkFetchException {

    public RecipeNotFoundException(String sourceUrl) {
        super(FetchOutcome.NOT_FOUND, "No recipe data found at " + sourceUrl, null);
    }
}
