package fr.lapetina.inferencebench.domain.metrics;

/**
 * Request-size buckets keyed on prompt token count.
 */
public enum InputTokenBucket {
    UP_TO_256("0-256", 256),
    UP_TO_1024("257-1024", 1024),
    UP_TO_4096("1025-4096", 4096),
    UP_TO_8192("4097-8192", 8192),
    ABOVE_8192("8192+", Integer.MAX_VALUE);

    /** Dimension name written next to every bucket label. */
    public static final String DIMENSION = "input_tokens";

    private final String label;
    private final int upperBound;

    InputTokenBucket(String label, int upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    public String getLabel() {
        return label;
    }

    public static InputTokenBucket forTokens(int inputTokens) {
        for (InputTokenBucket bucket : values()) {
            if (inputTokens <= bucket.upperBound) {
                return bucket;
            }
        }
        return ABOVE_8192;
    }
}
