package com.newsinsight.ingest.exception;

public class TopicNotFoundException extends IngestException {

    public TopicNotFoundException(String query) {
        super("TOPIC_NOT_FOUND", "Topic not found: " + query);
    }
}
