package com.newspulse.ingestor.processing;

import com.newspulse.ingestor.model.Article;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    Article article;
    ValidationError error;

    public static ValidationResult valid(Article article) {
        return new ValidationResult(article, null);
    }

    public static ValidationResult invalid(Article article, ValidationError error) {
        return new ValidationResult(article, error);
    }

    public boolean isValid() {
        return error == null;
    }
}
