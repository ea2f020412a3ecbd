package com.newspulse.ingestor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Canonical article written to the stream.
 * <p>
 * The JSON form of this class is the wire record consumers read, so property
 * names are fixed. {@code id} depends only on source name, title and url.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"article_id", "source_name", "title", "content", "url", "author", "published_at", "ingested_at"})
public class Article {

    @NonNull
    @JsonProperty("article_id")
    String id;

    @NonNull
    @JsonProperty("source_name")
    String sourceName;

    @JsonProperty("title")
    String title;

    @NonNull
    @JsonProperty("content")
    String content;

    @JsonProperty("url")
    String url;

    @JsonProperty("author")
    String author;

    @JsonProperty("published_at")
    Instant publishedAt;

    @NonNull
    @JsonProperty("ingested_at")
    Instant ingestedAt;
}
