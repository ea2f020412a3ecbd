package com.newspulse.ingestor.writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newspulse.ingestor.model.Article;
import com.newspulse.ingestor.stream.StreamRecord;

/**
 * Serializes articles to the JSON wire record, keyed by article id
 */
public class ArticleRecordMapper {

    private final ObjectMapper mapper;

    public ArticleRecordMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public StreamRecord toRecord(Article article) throws JsonProcessingException {
        return new StreamRecord(article.getId(), mapper.writeValueAsBytes(article));
    }
}
