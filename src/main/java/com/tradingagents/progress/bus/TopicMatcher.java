package com.tradingagents.progress.bus;

import com.tradingagents.progress.message.Topics;

/**
 * Matches topics against filters where {@code *} stands for exactly one segment
 * and a trailing {@code #} for any number of remaining segments.
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    public static boolean matches(String filter, String topic) {
        if (filter.equals(topic)) {
            return true;
        }
        String[] filterParts = filter.split("/", -1);
        String[] topicParts = topic.split("/", -1);

        for (int i = 0; i < filterParts.length; i++) {
            String part = filterParts[i];
            if (Topics.MULTI_LEVEL_WILDCARD.equals(part)) {
                return i < topicParts.length;
            }
            if (i >= topicParts.length) {
                return false;
            }
            if (!Topics.SINGLE_LEVEL_WILDCARD.equals(part) && !part.equals(topicParts[i])) {
                return false;
            }
        }
        return filterParts.length == topicParts.length;
    }

    /**
     * Redis glob for a filter. The glob is wider than the filter ({@code *} crosses '/'),
     * so received messages are matched again with {@link #matches}.
     */
    public static String toRedisPattern(String filter) {
        return filter.replace(Topics.MULTI_LEVEL_WILDCARD, "*");
    }

    /** Topic without its last segment, i.e. the kind part of "task/progress/{id}" */
    public static String baseOf(String topic) {
        int lastSlash = topic.lastIndexOf('/');
        return lastSlash > 0 ? topic.substring(0, lastSlash) : topic;
    }
}
