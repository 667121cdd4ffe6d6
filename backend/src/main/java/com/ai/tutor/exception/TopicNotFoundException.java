package com.ai.tutor.exception;

/**
 * Raised when a request names a topic that does not exist. Reported to the
 * caller instead of silently substituting another topic.
 */
public class TopicNotFoundException extends RuntimeException {

    public TopicNotFoundException(Long topicId) {
        super("Topic not found: " + topicId);
    }
}
