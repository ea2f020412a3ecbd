package com.newspulse.ingestor.processing;

import com.newspulse.ingestor.model.Article;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Checks the required fields of a canonical article. Reports only the first
 * rule violated and never modifies the article.
 */
public class ArticleValidator {

    public ValidationResult validate(Article article) {
        if (article.getTitle() == null || article.getTitle().isBlank()) {
            return ValidationResult.invalid(article, ValidationError.MISSING_TITLE);
        }
        if (!isAbsoluteUrl(article.getUrl())) {
            return ValidationResult.invalid(article, ValidationError.MISSING_OR_MALFORMED_URL);
        }
        if (article.getPublishedAt() == null) {
            return ValidationResult.invalid(article, ValidationError.MISSING_OR_MALFORMED_PUBLISHED_AT);
        }
        return ValidationResult.valid(article);
    }

    static boolean isAbsoluteUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            if (!uri.isAbsolute() || uri.getScheme() == null) {
                return false;
            }
            String scheme = uri.getScheme().toLowerCase();
            if (scheme.equals("http") || scheme.equals("https")) {
                return uri.getHost() != null && !uri.getHost().isEmpty();
            }
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
