package uk.gegc.cooksnap.features.scrape.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsoupRecipeExtractor Tests")
class JsoupRecipeExtractorTest {

    private static final String SOURCE = "https://recipes.example/pancakes";

    private final JsoupRecipeExtractor extractor = new JsoupRecipeExtractor(new ObjectMapper());

    private static String page(String head, String body) {
        return "<!DOCTYPE html><html><head>" + head + "</head><body>" + body + "</body></html>";
    }

    private static String jsonLd(String json) {
        return "<script type=\"application/ld+json\">" + json + "</script>";
    }

    @Nested
    @DisplayName("JSON-LD")
    class JsonLd {

        @Test
        @DisplayName("extract: when a Recipe object is present then maps all fields")
        void extract_fullRecipe() {
            // Given
            String html = page(jsonLd("""
                    {
                      "@context": "https://schema.org",
                      "@type": "Recipe",
                      "name": "Classic Pancakes",
                      "image": "https://recipes.example/img/pancakes.jpg",
                      "recipeIngredient": ["2 cups flour", "2 eggs", "1 cup milk"],
                      "recipeInstructions": [
                        {"@type": "HowToStep", "text": "Whisk everything."},
                        {"@type": "HowToStep", "text": "Fry in a hot pan."}
                      ],
                      "prepTime": "PT10M",
                      "cookTime": "PT20M",
                      "totalTime": "PT30M",
                      "recipeYield": "4 servings",
                      "author": {"@type": "Person", "name": "Jamie Cook"},
                      "recipeCuisine": ["French", "Breakfast"]
                    }
                    """), "");

            // When
            var result = extractor.extract(html, SOURCE);

            // Then
            assertThat(result).isPresent();
            ScrapedRecipe recipe = result.get();
            assertThat(recipe.title()).isEqualTo("Classic Pancakes");
            assertThat(recipe.image()).isEqualTo("https://recipes.example/img/pancakes.jpg");
            assertThat(recipe.ingredients()).containsExactly("2 cups flour", "2 eggs", "1 cup milk");
            assertThat(recipe.instructions()).containsExactly("Whisk everything.", "Fry in a hot pan.");
            assertThat(recipe.prepTime()).isEqualTo("PT10M");
            assertThat(recipe.cookTime()).isEqualTo("PT20M");
            assertThat(recipe.totalTime()).isEqualTo("PT30M");
            assertThat(recipe.servings()).isEqualTo(4);
            assertThat(recipe.author()).isEqualTo("Jamie Cook");
            assertThat(recipe.cuisine()).isEqualTo("French, Breakfast");
            assertThat(recipe.sourceUrl()).isEqualTo(SOURCE);
        }

        @Test
        @DisplayName("extract: when the recipe sits inside @graph with an array @type then finds it")
        void extract_graphAndArrayType() {
            String html = page(jsonLd("""
                    {
                      "@context": "https://schema.org",
                      "@graph": [
                        {"@type": "WebPage", "name": "Pancakes page"},
                        {
                          "@type": ["Recipe", "NewsArticle"],
                          "name": "Graph Pancakes",
                          "image": [{"@type": "ImageObject", "url": "https://recipes.example/a.jpg"}],
                          "recipeIngredient": ["flour"],
                          "recipeYield": 6
                        }
                      ]
                    }
                    """), "");

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.title()).isEqualTo("Graph Pancakes");
            assertThat(recipe.image()).isEqualTo("https://recipes.example/a.jpg");
            assertThat(recipe.ingredients()).containsExactly("flour");
            assertThat(recipe.instructions()).isEmpty();
            assertThat(recipe.servings()).isEqualTo(6);
        }

        @Test
        @DisplayName("extract: when instructions are grouped in sections then flattens the steps")
        void extract_howToSections() {
            String html = page(jsonLd("""
                    {
                      "@type": "Recipe",
                      "name": "Layered",
                      "recipeIngredient": ["sugar"],
                      "recipeInstructions": [
                        {"@type": "HowToSection", "name": "Batter",
                         "itemListElement": [{"@type": "HowToStep", "text": "Mix."}, {"@type": "HowToStep", "text": "Rest."}]},
                        {"@type": "HowToSection", "name": "Cooking",
                         "itemListElement": [{"@type": "HowToStep", "text": "Fry."}]}
                      ]
                    }
                    """), "");

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.instructions()).containsExactly("Mix.", "Rest.", "Fry.");
        }

        @Test
        @DisplayName("extract: when instructions are one string then splits on line breaks")
        void extract_instructionString() {
            String html = page(jsonLd("""
                    {"@type": "Recipe", "recipeIngredient": ["salt"], "recipeInstructions": "Boil water.\\n\\nAdd salt."}
                    """), "");

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.title()).isEqualTo(JsoupRecipeExtractor.UNTITLED);
            assertThat(recipe.instructions()).containsExactly("Boil water.", "Add salt.");
        }

        @Test
        @DisplayName("extract: when an earlier JSON-LD block is malformed then later blocks are still used")
        void extract_malformedBlockSkipped() {
            String html = page(
                    jsonLd("{ this is not json")
                            + jsonLd("{\"@type\": \"Recipe\", \"name\": \"Survivor\", \"recipeIngredient\": [\"egg\"]}"),
                    "");

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.title()).isEqualTo("Survivor");
        }

        @Test
        @DisplayName("extract: when the Recipe object has neither ingredients nor instructions then falls through")
        void extract_emptyRecipeIgnored() {
            String html = page(jsonLd("{\"@type\": \"Recipe\", \"name\": \"Empty\"}"), "<p>Nothing here</p>");

            assertThat(extractor.extract(html, SOURCE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Microdata")
    class Microdata {

        @Test
        @DisplayName("extract: when schema.org microdata is present then reads itemprops")
        void extract_microdata() {
            String html = page("", """
                    <div itemscope itemtype="https://schema.org/Recipe">
                      <h1 itemprop="name">Micro Muffins</h1>
                      <img itemprop="image" src="/img/muffins.jpg">
                      <meta itemprop="prepTime" content="PT15M">
                      <time itemprop="cookTime" datetime="PT25M">25 minutes</time>
                      <span itemprop="recipeYield">12 muffins</span>
                      <ul>
                        <li itemprop="recipeIngredient">1 cup flour</li>
                        <li itemprop="recipeIngredient">1 cup blueberries</li>
                      </ul>
                      <ol itemprop="recipeInstructions">
                        <li>Mix.</li>
                        <li>Bake.</li>
                      </ol>
                    </div>
                    """);

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.title()).isEqualTo("Micro Muffins");
            assertThat(recipe.image()).isEqualTo("https://recipes.example/img/muffins.jpg");
            assertThat(recipe.prepTime()).isEqualTo("PT15M");
            assertThat(recipe.cookTime()).isEqualTo("PT25M");
            assertThat(recipe.servings()).isEqualTo(12);
            assertThat(recipe.ingredients()).containsExactly("1 cup flour", "1 cup blueberries");
            assertThat(recipe.instructions()).containsExactly("Mix.", "Bake.");
        }
    }

    @Nested
    @DisplayName("OpenGraph heuristic")
    class OpenGraph {

        @Test
        @DisplayName("extract: when only OpenGraph tags and lists exist then builds a basic recipe")
        void extract_openGraphLists() {
            String html = page("""
                    <meta property="og:title" content="Grandma's Soup">
                    <meta property="og:image" content="https://recipes.example/soup.jpg">
                    """, """
                    <ul><li>1 onion</li><li>2 carrots</li><li>1 onion</li></ul>
                    <ol><li>Chop.</li><li>Simmer.</li></ol>
                    """);

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.title()).isEqualTo("Grandma's Soup");
            assertThat(recipe.image()).isEqualTo("https://recipes.example/soup.jpg");
            assertThat(recipe.ingredients()).containsExactly("1 onion", "2 carrots");
            assertThat(recipe.instructions()).containsExactly("Chop.", "Simmer.");
            assertThat(recipe.servings()).isNull();
        }

        @Test
        @DisplayName("extract: when list items are too long then they are not taken as ingredients")
        void extract_longItemsDropped() {
            String longLine = "x".repeat(250);
            String html = page("<title>Plain Title</title>",
                    "<ul><li>" + longLine + "</li><li>3 apples</li></ul>");

            var recipe = extractor.extract(html, SOURCE).orElseThrow();

            assertThat(recipe.title()).isEqualTo("Plain Title");
            assertThat(recipe.ingredients()).containsExactly("3 apples");
        }
    }

    @Test
    @DisplayName("extract: when the page has no recipe markup then returns empty")
    void extract_noRecipe() {
        String html = page("<title>About us</title>", "<p>We are a small team.</p>");

        assertThat(extractor.extract(html, SOURCE)).isEmpty();
    }

    @Test
    @DisplayName("extract: when the body is blank then returns empty")
    void extract_blank() {
        assertThat(extractor.extract("  ", SOURCE)).isEmpty();
    }
}
