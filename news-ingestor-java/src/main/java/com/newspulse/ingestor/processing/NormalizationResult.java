package com.newspulse.ingestor.processing;

import com.newspulse.ingestor.model.Article;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a normalized article or the reason the source record was skipped.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizationResult {

    Article article;
    SkipReason skipReason;
    String detail;

    public static NormalizationResult normalized(Article article) {
        return new NormalizationResult(article, null, null);
    }

    public static NormalizationResult skipped(SkipReason reason, String detail) {
        return new NormalizationResult(null, reason, detail);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
