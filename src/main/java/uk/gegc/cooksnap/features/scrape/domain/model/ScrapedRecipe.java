package uk.gegc.cooksnap.features.scrape.domain.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ScrapedRecipe", description = "Recipe data extracted from a web page")
public record ScrapedRecipe(
        @Schema(description = "Recipe title", example = "Classic Pancakes")
        String title,

        @Schema(description = "Absolute or page-relative image URL", nullable = true)
        String image,

        @Schema(description = "Ingredient lines in page order")
        List<String> ingredients,

        @Schema(description = "Instruction steps in page order")
        List<String> instructions,

        @Schema(description = "ISO-8601 duration or free text", nullable = true, example = "PT10M")
        String prepTime,

        @Schema(nullable = true, example = "PT20M")
        String cookTime,

        @Schema(nullable = true, example = "PT30M")
        String totalTime,

        @Schema(description = "Number of servings when stated", nullable = true, example = "4")
        Integer servings,

        @Schema(nullable = true)
        String author,

        @Schema(nullable = true, example = "French")
        String cuisine,

        @Schema(description = "URL the recipe was imported from")
        String sourceUrl
) {
    public ScrapedRecipe {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }

    public static ScrapedRecipe basic(String title, String image, List<String> ingredients,
                                      List<String> instructions, String sourceUrl) {
        return new ScrapedRecipe(title, image, ingredients, instructions,
                null, null, null, null, null, null, sourceUrl);
    }
}
