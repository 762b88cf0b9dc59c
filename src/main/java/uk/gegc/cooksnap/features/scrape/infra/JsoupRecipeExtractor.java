package uk.gegc.cooksnap.features.scrape.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;
import uk.gegc.cooksnap.features.scrape.application.RecipeExtractor;
import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recipe extractor for static HTML using JSoup.
 * Strategies in order: JSON-LD structured data, schema.org microdata, then OpenGraph tags
 * with a list heuristic. Malformed structured data is skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsoupRecipeExtractor implements RecipeExtractor {

    static final String UNTITLED = "Untitled Recipe";
    private static final int MAX_INGREDIENT_LENGTH = 200;
    private static final int MAX_INSTRUCTION_LENGTH = 1000;
    private static final Pattern LEADING_NUMBER = Pattern.compile("(\\d+)");

    private final ObjectMapper objectMapper;

    @Override
    public Optional<ScrapedRecipe> extract(String html, String sourceUrl) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document doc = Jsoup.parse(html, sourceUrl == null ? "" : sourceUrl);

        Optional<ScrapedRecipe> recipe = fromJsonLd(doc, sourceUrl);
        if (recipe.isEmpty()) {
            recipe = fromMicrodata(doc, sourceUrl);
        }
        if (recipe.isEmpty()) {
            recipe = fromOpenGraph(doc, sourceUrl);
        }
        recipe.ifPresent(r -> log.debug("Extracted '{}' from {} ({} ingredients, {} steps)",
                r.title(), sourceUrl, r.ingredients().size(), r.instructions().size()));
        return recipe;
    }

    // JSON-LD

    private Optional<ScrapedRecipe> fromJsonLd(Document doc, String sourceUrl) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String raw = script.data();
            if (raw.isBlank()) {
                continue;
            }
            try {
                Optional<ScrapedRecipe> recipe = findRecipe(objectMapper.readTree(raw), sourceUrl);
                if (recipe.isPresent()) {
                    return recipe;
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", sourceUrl, e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<ScrapedRecipe> findRecipe(JsonNode node, String sourceUrl) {
        if (node == null || !(node.isObject() || node.isArray())) {
            return Optional.empty();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                Optional<ScrapedRecipe> recipe = findRecipe(item, sourceUrl);
                if (recipe.isPresent()) {
                    return recipe;
                }
            }
            return Optional.empty();
        }

        JsonNode graph = node.get("@graph");
        if (graph != null && graph.isArray()) {
            Optional<ScrapedRecipe> recipe = findRecipe(graph, sourceUrl);
            if (recipe.isPresent()) {
                return recipe;
            }
        }

        if (!isRecipeType(node.get("@type"))) {
            return Optional.empty();
        }

        List<String> ingredients = stringList(node.get("recipeIngredient"));
        if (ingredients.isEmpty()) {
            ingredients = stringList(node.get("ingredients"));
        }
        List<String> instructions = instructionList(node.get("recipeInstructions"));
        if (ingredients.isEmpty() && instructions.isEmpty()) {
            return Optional.empty();
        }

        String title = text(node.get("name")).orElse(UNTITLED);
        Integer servings = servings(node.has("recipeYield") ? node.get("recipeYield") : node.get("yield"));

        return Optional.of(new ScrapedRecipe(
                title,
                image(node.get("image")),
                ingredients,
                instructions,
                text(node.get("prepTime")).orElse(null),
                text(node.get("cookTime")).orElse(null),
                text(node.get("totalTime")).orElse(null),
                servings,
                author(node.get("author")),
                cuisine(node.get("recipeCuisine")),
                sourceUrl));
    }

    private boolean isRecipeType(JsonNode type) {
        if (type == null) {
            return false;
        }
        if (type.isTextual()) {
            return "Recipe".equals(type.asText());
        }
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && "Recipe".equals(t.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private String image(JsonNode image) {
        if (image == null || image.isNull()) {
            return null;
        }
        if (image.isTextual()) {
            return blankToNull(image.asText());
        }
        if (image.isArray()) {
            return image.isEmpty() ? null : image(image.get(0));
        }
        if (image.isObject()) {
            return text(image.get("url")).orElse(null);
        }
        return null;
    }

    private List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isTextual()) {
            text(node).ifPresent(values::add);
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    text(item.get("text")).or(() -> text(item.get("name"))).ifPresent(values::add);
                } else {
                    text(item).ifPresent(values::add);
                }
            }
        }
        return values;
    }

    private List<String> instructionList(JsonNode node) {
        List<String> steps = new ArrayList<>();
        if (node == null || node.isNull()) {
            return steps;
        }
        if (node.isTextual()) {
            for (String line : node.asText().split("\\n+")) {
                if (!line.isBlank()) {
                    steps.add(line.trim());
                }
            }
            return steps;
        }
        if (!node.isArray()) {
            return steps;
        }
        for (JsonNode item : node) {
            if (item.isTextual()) {
                text(item).ifPresent(steps::add);
            } else if (item.isObject()) {
                JsonNode elements = item.get("itemListElement");
                if ("HowToSection".equals(item.path("@type").asText()) && elements != null && elements.isArray()) {
                    for (JsonNode step : elements) {
                        if (step.isObject()) {
                            text(step.get("text")).ifPresent(steps::add);
                        } else {
                            text(step).ifPresent(steps::add);
                        }
                    }
                } else {
                    text(item.get("text")).or(() -> text(item.get("name"))).ifPresent(steps::add);
                }
            }
        }
        return steps;
    }

    private Integer servings(JsonNode yield) {
        if (yield == null || yield.isNull()) {
            return null;
        }
        if (yield.isArray()) {
            for (JsonNode item : yield) {
                Integer value = servings(item);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
        if (yield.isIntegralNumber()) {
            return yield.asInt();
        }
        if (yield.isTextual()) {
            Matcher matcher = LEADING_NUMBER.matcher(yield.asText());
            if (matcher.find()) {
                try {
                    return Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring unparseable yield '{}'", yield.asText());
                }
            }
        }
        return null;
    }

    private String author(JsonNode author) {
        if (author == null || author.isNull()) {
            return null;
        }
        if (author.isArray()) {
            return author.isEmpty() ? null : author(author.get(0));
        }
        if (author.isObject()) {
            return text(author.get("name")).orElse(null);
        }
        return text(author).orElse(null);
    }

    private String cuisine(JsonNode cuisine) {
        if (cuisine != null && cuisine.isArray()) {
            List<String> values = stringList(cuisine);
            return values.isEmpty() ? null : String.join(", ", values);
        }
        return text(cuisine).orElse(null);
    }

    private Optional<String> text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.ofNullable(blankToNull(node.asText()));
    }

    // Microdata

    private Optional<ScrapedRecipe> fromMicrodata(Document doc, String sourceUrl) {
        Element recipe = doc.selectFirst("[itemtype*=schema.org/Recipe]");
        if (recipe == null) {
            return Optional.empty();
        }

        List<String> ingredients = texts(recipe.select("[itemprop=recipeIngredient], [itemprop=ingredients]"), Integer.MAX_VALUE);
        List<String> instructions = texts(recipe.select(
                "[itemprop=recipeInstructions] [itemprop=text], [itemprop=recipeInstructions] li"), Integer.MAX_VALUE);
        if (instructions.isEmpty()) {
            instructions = texts(recipe.select("[itemprop=recipeInstructions]"), Integer.MAX_VALUE);
        }
        if (ingredients.isEmpty() && instructions.isEmpty()) {
            return Optional.empty();
        }

        Element name = recipe.selectFirst("[itemprop=name]");
        String title = name == null ? UNTITLED : Optional.ofNullable(blankToNull(name.text())).orElse(UNTITLED);

        String image = null;
        Element imageEl = recipe.selectFirst("[itemprop=image]");
        if (imageEl != null) {
            image = blankToNull(imageEl.hasAttr("src") ? imageEl.absUrl("src") : imageEl.attr("content"));
        }

        return Optional.of(new ScrapedRecipe(
                title,
                image,
                ingredients,
                instructions,
                itemprop(recipe, "prepTime"),
                itemprop(recipe, "cookTime"),
                itemprop(recipe, "totalTime"),
                microdataServings(recipe),
                itemprop(recipe, "author"),
                itemprop(recipe, "recipeCuisine"),
                sourceUrl));
    }

    private String itemprop(Element scope, String property) {
        Element el = scope.selectFirst("[itemprop=" + property + "]");
        if (el == null) {
            return null;
        }
        String content = el.hasAttr("content") ? el.attr("content")
                : el.hasAttr("datetime") ? el.attr("datetime")
                : el.text();
        return blankToNull(content);
    }

    private Integer microdataServings(Element scope) {
        String yield = itemprop(scope, "recipeYield");
        if (yield == null) {
            return null;
        }
        return servings(objectMapper.getNodeFactory().textNode(yield));
    }

    // OpenGraph and list heuristic

    private Optional<ScrapedRecipe> fromOpenGraph(Document doc, String sourceUrl) {
        String title = metaContent(doc, "og:title");
        if (title == null) {
            title = blankToNull(doc.title());
        }
        if (title == null) {
            return Optional.empty();
        }

        List<String> ingredients = texts(doc.select(
                "ul li, .ingredient, .ingredients li, [class*=ingredient] li"), MAX_INGREDIENT_LENGTH);
        List<String> instructions = texts(doc.select(
                "ol li, .instruction, .instructions li, .step, .steps li, "
                        + "[class*=instruction] li, [class*=direction] li, [class*=step] li"), MAX_INSTRUCTION_LENGTH);
        if (ingredients.isEmpty() && instructions.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ScrapedRecipe.basic(title, metaContent(doc, "og:image"), ingredients, instructions, sourceUrl));
    }

    private String metaContent(Document doc, String property) {
        Element meta = doc.selectFirst("meta[property=" + property + "]");
        return meta == null ? null : blankToNull(meta.attr("content"));
    }

    /**
     * Trimmed, non-empty element texts shorter than {@code maxLength}, in document order and without repeats.
     */
    private List<String> texts(Elements elements, int maxLength) {
        Set<String> values = new LinkedHashSet<>();
        for (Element el : elements) {
            String text = el.text().trim();
            if (!text.isEmpty() && text.length() < maxLength) {
                values.add(text);
            }
        }
        return new ArrayList<>(values);
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
