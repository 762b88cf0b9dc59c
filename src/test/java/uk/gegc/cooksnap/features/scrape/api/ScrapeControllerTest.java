package uk.gegc.cooksnap.features.scrape.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.test.context.support.WithAnonymousUser;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.cooksnap.features.scrape.application.ScrapeService;
import uk.gegc.cooksnap.features.scrape.domain.ContentTooLargeException;
import uk.gegc.cooksnap.features.scrape.domain.FetchTimeoutException;
import uk.gegc.cooksnap.features.scrape.domain.InvalidScrapeRequestException;
import uk.gegc.cooksnap.features.scrape.domain.LinkFetchException;
import uk.gegc.cooksnap.features.scrape.domain.NotHtmlContentException;
import uk.gegc.cooksnap.features.scrape.domain.RecipeNotFoundException;
import uk.gegc.cooksnap.features.scrape.domain.RedirectLimitExceededException;
import uk.gegc.cooksnap.features.scrape.domain.SsrfProtectionException;
import uk.gegc.cooksnap.features.scrape.domain.UpstreamStatusException;
import uk.gegc.cooksnap.features.scrape.domain.model.ScrapedRecipe;
import uk.gegc.cooksnap.shared.config.SecurityConfig;
import uk.gegc.cooksnap.shared.exception.RateLimitExceededException;
import uk.gegc.cooksnap.shared.security.JwtTokenService;

import java.util.List;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScrapeController.class)
@Import(SecurityConfig.class)
@WithMockUser(username = "user-42")
class ScrapeControllerTest {

    private static final String ENDPOINT = "/api/v1/scrape";
    private static final String BODY = "{\"url\":\"https://recipes.example/pancakes\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ScrapeService scrapeService;

    @MockitoBean
    private JwtTokenService jwtTokenService;

    @Test
    @DisplayName("POST /api/v1/scrape returns the extracted recipe")
    void scrape_success() throws Exception {
        ScrapedRecipe recipe = new ScrapedRecipe("Pancakes", "https://recipes.example/p.jpg",
                List.of("200 g flour", "2 eggs"), List.of("Whisk", "Fry"),
                "PT10M", "PT20M", "PT30M", 4, "Jane", "French", "https://recipes.example/pancakes");
        when(scrapeService.scrape("user-42", BODY)).thenReturn(recipe);

        mockMvc.perform(post(ENDPOINT)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Pancakes"))
                .andExpect(jsonPath("$.ingredients.length()").value(2))
                .andExpect(jsonPath("$.servings").value(4))
                .andExpect(jsonPath("$.sourceUrl").value("https://recipes.example/pancakes"));
    }

    @Test
    @WithAnonymousUser
    @DisplayName("POST /api/v1/scrape without credentials returns 401 and never reaches the service")
    void scrape_unauthenticated() throws Exception {
        mockMvc.perform(post(ENDPOINT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Authentication required."));

        verifyNoInteractions(scrapeService);
    }

    @Test
    @WithAnonymousUser
    @DisplayName("POST /api/v1/scrape with a valid bearer token scrapes as the token subject")
    void scrape_bearerToken() throws Exception {
        when(jwtTokenService.validateToken("good-token")).thenReturn(true);
        when(jwtTokenService.getAuthentication("good-token"))
                .thenReturn(new UsernamePasswordAuthenticationToken("user-7", null, List.of()));
        when(scrapeService.scrape(eq("user-7"), anyString())).thenReturn(
                ScrapedRecipe.basic("Soup", null, List.of("water"), List.of("Boil"), "https://recipes.example/soup"));

        mockMvc.perform(post(ENDPOINT)
                        .header("Authorization", "Bearer good-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Soup"));

        verify(scrapeService).scrape("user-7", BODY);
    }

    @Test
    @WithAnonymousUser
    @DisplayName("POST /api/v1/scrape with an invalid bearer token returns 401")
    void scrape_invalidBearerToken() throws Exception {
        when(jwtTokenService.validateToken("forged")).thenReturn(false);

        mockMvc.perform(post(ENDPOINT)
                        .header("Authorization", "Bearer forged")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(scrapeService);
    }

    @Test
    @DisplayName("POST /api/v1/scrape over quota returns 429 with Retry-After")
    void scrape_rateLimited() throws Exception {
        when(scrapeService.scrape(anyString(), any())).thenThrow(new RateLimitExceededException(60));

        mockMvc.perform(post(ENDPOINT)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(60))
                .andExpect(jsonPath("$.error").value(RateLimitExceededException.DEFAULT_MESSAGE));
    }

    @Nested
    @WithMockUser(username = "user-42")
    @DisplayName("Error mapping")
    class ErrorMapping {

        @Test
        @DisplayName("invalid input maps to 400 with the specific message")
        void invalidInput() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new InvalidScrapeRequestException("URL is required"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("URL is required"));
        }

        @Test
        @DisplayName("missing body is handed to the service, which decides it is invalid")
        void missingBody() throws Exception {
            when(scrapeService.scrape("user-42", null)).thenThrow(new InvalidScrapeRequestException("Invalid request body."));

            mockMvc.perform(post(ENDPOINT).with(csrf()))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid request body."));
        }

        @Test
        @DisplayName("malformed JSON is handed to the service verbatim and reported as an invalid body")
        void malformedJsonBody() throws Exception {
            when(scrapeService.scrape("user-42", "{\"url\": oops")).thenThrow(
                    new InvalidScrapeRequestException("Invalid request body."));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content("{\"url\": oops"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type").value(containsString("/invalid-scrape-request")))
                    .andExpect(jsonPath("$.error").value("Invalid request body."));

            verify(scrapeService).scrape("user-42", "{\"url\": oops");
        }

        @Test
        @DisplayName("SSRF block maps to 400 without leaking the resolved address")
        void ssrfBlocked() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(
                    new SsrfProtectionException("Host internal.example resolves to blocked address 10.0.0.7"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid URL. Requests to private addresses are not allowed."))
                    .andExpect(content().string(not(containsString("10.0.0.7"))));
        }

        @Test
        @DisplayName("too many redirects maps to 400 like any other blocked fetch")
        void tooManyRedirects() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new RedirectLimitExceededException(5));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isBadRequest());
        }

        @ParameterizedTest(name = "upstream {0} -> {1}")
        @CsvSource({"404, 422", "403, 403", "429, 429", "500, 502", "410, 502"})
        @DisplayName("upstream status is translated for the caller")
        void upstreamStatus(int upstream, int expected) throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new UpstreamStatusException(upstream));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().is(expected))
                    .andExpect(jsonPath("$.upstreamStatus").value(upstream));
        }

        @Test
        @DisplayName("non-HTML content maps to 422")
        void notHtml() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new NotHtmlContentException("application/json"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value(
                            "The URL did not return an HTML page. Only HTML recipe pages are supported."))
                    .andExpect(jsonPath("$.contentType").value("application/json"));
        }

        @Test
        @DisplayName("oversized page maps to 422 naming the limit")
        void tooLarge() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new ContentTooLargeException(5_242_880));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("Response too large (max 5 MB)."));
        }

        @Test
        @DisplayName("timeout maps to 504")
        void timeout() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new FetchTimeoutException("deadline exceeded"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isGatewayTimeout());
        }

        @Test
        @DisplayName("page without recipe maps to 422")
        void recipeNotFound() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new RecipeNotFoundException("https://recipes.example/blog"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value(
                            "Could not find recipe data on this page. The site may not use standard recipe markup."));
        }

        @Test
        @DisplayName("transport failure maps to 502")
        void transportFailure() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new LinkFetchException("Failed to fetch URL: Connection reset"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isBadGateway());
        }

        @Test
        @DisplayName("unexpected failure maps to a generic 500")
        void unexpected() throws Exception {
            when(scrapeService.scrape(anyString(), any())).thenThrow(new IllegalStateException("pool exhausted at db-3"));

            mockMvc.perform(post(ENDPOINT).with(csrf()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").value("Something went wrong while scraping."))
                    .andExpect(content().string(not(containsString("db-3"))));
        }
    }
}
