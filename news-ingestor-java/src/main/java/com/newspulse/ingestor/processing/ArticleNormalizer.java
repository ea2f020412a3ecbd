package com.newspulse.ingestor.processing;

import com.newspulse.ingestor.model.Article;
import com.newspulse.ingestor.model.RawArticle;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Converts source records into canonical {@link Article}s.
 * <p>
 * Never throws on bad input: optional fields fall back to defaults and a record
 * missing a required field comes back as {@link NormalizationResult#skipped}.
 * Stateless apart from the clock, so one instance can be shared across threads.
 */
public class ArticleNormalizer {

    /**
     * Placeholder NewsAPI puts in every field of a withdrawn article
     */
    static final String REMOVED_PLACEHOLDER = "[Removed]";

    // ASCII unit separator; cleanText strips control characters, so it never occurs inside a field
    private static final String ID_SEPARATOR = "\u001F";
    private static final Pattern WHITESPACE_OR_CONTROL = Pattern.compile("[\\s\\p{Cntrl}]+");

    private final Clock clock;

    public ArticleNormalizer(Clock clock) {
        this.clock = clock;
    }

    public ArticleNormalizer() {
        this(Clock.systemUTC());
    }

    public NormalizationResult normalize(RawArticle raw) {
        if (raw == null) {
            return NormalizationResult.skipped(SkipReason.MALFORMED_RECORD, "null record");
        }
        String title = cleanText(raw.getTitle());
        if (title.isEmpty()) {
            return NormalizationResult.skipped(SkipReason.MISSING_TITLE, "url=" + raw.getUrl());
        }
        if (REMOVED_PLACEHOLDER.equals(title)) {
            return NormalizationResult.skipped(SkipReason.REMOVED_BY_SOURCE, "url=" + raw.getUrl());
        }

        String url = raw.getUrl() != null ? raw.getUrl().trim() : "";
        if (url.isEmpty()) {
            return NormalizationResult.skipped(SkipReason.MISSING_OR_MALFORMED_URL, "title=" + title);
        }

        Instant publishedAt = parseTimestamp(raw.getPublishedAt());
        if (publishedAt == null) {
            return NormalizationResult.skipped(SkipReason.MISSING_OR_MALFORMED_PUBLISHED_AT,
                    "url=" + url + ", publishedAt=" + raw.getPublishedAt());
        }

        String sourceName = cleanText(raw.getSourceName());
        String author = cleanText(raw.getAuthor());

        Article article = Article.builder()
                .id(articleId(sourceName, title, url))
                .sourceName(sourceName)
                .title(title)
                .content(extractContent(raw))
                .url(url)
                .author(author.isEmpty() ? null : author)
                .publishedAt(publishedAt)
                .ingestedAt(clock.instant())
                .build();
        return NormalizationResult.normalized(article);
    }

    /**
     * Hex encoded SHA-256 of the fields that identify an article across ingestions.
     */
    public static String articleId(String sourceName, String title, String url) {
        String key = String.join(ID_SEPARATOR, sourceName, title, url);
        return HexFormat.of().formatHex(sha256().digest(key.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Collapse runs of whitespace and control characters into one space and trim; null becomes empty
     */
    static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_OR_CONTROL.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Prefer the article body, falling back to the description when the body
     * is missing or withdrawn
     */
    static String extractContent(RawArticle raw) {
        String content = cleanText(raw.getContent());
        if (content.isEmpty() || REMOVED_PLACEHOLDER.equals(content)) {
            content = cleanText(raw.getDescription());
        }
        return REMOVED_PLACEHOLDER.equals(content) ? "" : content;
    }

    /**
     * Parse an ISO-8601 timestamp. Values without an offset are read as UTC.
     *
     * @return the instant, or null when absent or unparseable
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
