package com.newspulse.ingestor.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newspulse.ingestor.model.PollWindow;
import com.newspulse.ingestor.model.RawArticle;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * NewsAPI "everything" endpoint client.
 * <p>
 * Maps HTTP and API level errors onto {@link SourceTransientException} and
 * {@link SourceFatalException}. Page tokens are page numbers starting at 1.
 */
public class NewsApiClient implements NewsSearchClient {

    private static final Logger logger = LoggerFactory.getLogger(NewsApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://newsapi.org/v2/everything";

    /**
     * Largest page size the API accepts
     */
    static final int MAX_PAGE_SIZE = 100;

    private static final String API_KEY_HEADER = "X-Api-Key";
    private static final String CODE_RATE_LIMITED = "rateLimited";
    private static final String CODE_MAX_RESULTS_REACHED = "maximumResultsReached";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiKey;

    public NewsApiClient(OkHttpClient client, ObjectMapper mapper, String baseUrl, String apiKey) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.apiKey = apiKey;
    }

    public NewsApiClient(ObjectMapper mapper, String baseUrl, String apiKey) {
        this(new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build(), mapper, baseUrl, apiKey);
    }

    @Override
    public SearchPage search(SearchQuery query, PollWindow window, String pageToken) {
        int page = parsePage(pageToken);
        int pageSize = Math.min(query.getPageSize(), MAX_PAGE_SIZE);

        HttpUrl url = baseUrl.newBuilder()
                .addQueryParameter("q", query.getQuery())
                .addQueryParameter("pageSize", String.valueOf(pageSize))
                .addQueryParameter("sortBy", query.getSortBy())
                .addQueryParameter("language", query.getLanguage())
                .addQueryParameter("page", String.valueOf(page))
                .addQueryParameter("from", window.getFrom().truncatedTo(ChronoUnit.SECONDS).toString())
                .addQueryParameter("to", window.getTo().truncatedTo(ChronoUnit.SECONDS).toString())
                .build();

        Request request = new Request.Builder()
                .url(url)
                .header(API_KEY_HEADER, apiKey)
                .get()
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                return handleError(response, text, page);
            }

            JsonNode root = mapper.readTree(text);
            if ("error".equals(root.path("status").asText())) {
                return handleApiError(response.code(), root, page, null);
            }

            List<RawArticle> articles = new ArrayList<>();
            int malformed = 0;
            for (JsonNode node : root.path("articles")) {
                RawArticle article = readArticle(node, page);
                if (article == null) {
                    malformed++;
                } else {
                    articles.add(article);
                }
            }
            int totalResults = root.path("totalResults").asInt(0);

            logger.info("Fetched {} articles (page {}, total: {})", articles.size(), page, totalResults);

            int received = articles.size() + malformed;
            boolean more = received > 0 && (long) page * pageSize < totalResults;
            return new SearchPage(articles, totalResults, more ? String.valueOf(page + 1) : null, malformed);

        } catch (JsonProcessingException e) {
            throw new SourceTransientException("Unreadable NewsAPI response on page " + page, e);
        } catch (IOException e) {
            throw new SourceTransientException("NewsAPI request failed on page " + page + ": " + e.getMessage(), e);
        }
    }

    /**
     * Convert one entry of the articles array.
     *
     * @return the article, or null when the entry is not a readable article
     */
    private RawArticle readArticle(JsonNode node, int page) {
        if (!node.isObject()) {
            logger.warn("Skipping malformed article on page {}: expected an object, got {}", page, node.getNodeType());
            return null;
        }
        try {
            return mapper.treeToValue(node, RawArticle.class);
        } catch (JsonProcessingException e) {
            logger.warn("Skipping malformed article on page {} (url={}): {}",
                    page, node.path("url").asText(null), e.getOriginalMessage());
            return null;
        }
    }

    private SearchPage handleError(Response response, String text, int page) {
        JsonNode root;
        try {
            root = mapper.readTree(text.isEmpty() ? "{}" : text);
        } catch (JsonProcessingException e) {
            root = mapper.createObjectNode();
        }
        return handleApiError(response.code(), root, page, parseRetryAfter(response.header("Retry-After")));
    }

    private SearchPage handleApiError(int status, JsonNode root, int page, Duration retryAfter) {
        String code = root.path("code").asText("");
        String message = root.path("message").asText("HTTP " + status);

        if (CODE_MAX_RESULTS_REACHED.equals(code)) {
            logger.info("NewsAPI result cap reached at page {}, stopping pagination", page);
            return SearchPage.last(List.of(), 0);
        }
        if (status == 429 || CODE_RATE_LIMITED.equals(code)) {
            throw new SourceTransientException("NewsAPI rate limited: " + message, retryAfter, null);
        }
        if (status >= 500) {
            throw new SourceTransientException("NewsAPI server error " + status + ": " + message);
        }
        logger.error("NewsAPI error ({} {}): {}", status, code, message);
        throw new SourceFatalException("NewsAPI error " + status + " (" + code + "): " + message);
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric Retry-After header: {}", header);
            return null;
        }
    }

    private static int parsePage(String pageToken) {
        if (pageToken == null) {
            return 1;
        }
        try {
            return Integer.parseInt(pageToken);
        } catch (NumberFormatException e) {
            throw new SourceFatalException("Invalid page token: " + pageToken, e);
        }
    }
}
