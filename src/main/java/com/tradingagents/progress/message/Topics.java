package com.tradingagents.progress.message;

/**
 * Topic naming: {@code kind with '.' replaced by '/'} + "/" + analysisId.
 */
public final class Topics {

    public static final String SINGLE_LEVEL_WILDCARD = "*";
    public static final String MULTI_LEVEL_WILDCARD = "#";

    private Topics() {
    }

    public static String topicFor(MessageKind kind, String analysisId) {
        requireValidAnalysisId(analysisId);
        return kind.topicBase() + "/" + analysisId;
    }

    /** Filter matching the given kind for every job */
    public static String wildcardFor(MessageKind kind) {
        return kind.topicBase() + "/" + SINGLE_LEVEL_WILDCARD;
    }

    public static boolean isWildcard(String topicFilter) {
        return topicFilter.contains(SINGLE_LEVEL_WILDCARD) || topicFilter.contains(MULTI_LEVEL_WILDCARD);
    }

    /**
     * Ids must be a single non-blank topic segment so that no two jobs can share a topic.
     */
    public static void requireValidAnalysisId(String analysisId) {
        if (!isValidAnalysisId(analysisId)) {
            throw new IllegalArgumentException("Invalid analysis id: '" + analysisId + "'");
        }
    }

    public static boolean isValidAnalysisId(String analysisId) {
        if (analysisId == null || analysisId.isBlank()) {
            return false;
        }
        for (int i = 0; i < analysisId.length(); i++) {
            char c = analysisId.charAt(i);
            if (c == '/' || c == '*' || c == '#' || Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }
}
