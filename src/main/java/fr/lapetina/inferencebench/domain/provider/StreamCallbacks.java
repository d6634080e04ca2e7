package fr.lapetina.inferencebench.domain.provider;

import fr.lapetina.inferencebench.domain.model.ChatMessage;
import fr.lapetina.inferencebench.domain.model.StreamMetadata;

import java.util.function.Consumer;

/**
 * Caller hooks for a streamed exchange.
 *
 * <p>{@code onChunk} fires zero or more times, always before {@code onComplete}, which fires
 * at most once. Either hook may be null. An exception thrown by a hook aborts the stream
 * and propagates out of {@link ChatProvider#stream}.
 */
public record StreamCallbacks(Consumer<ChatMessage> onChunk, Consumer<StreamMetadata> onComplete) {

    private static final StreamCallbacks NONE = new StreamCallbacks(null, null);

    public static StreamCallbacks none() {
        return NONE;
    }

    public static StreamCallbacks onComplete(Consumer<StreamMetadata> onComplete) {
        return new StreamCallbacks(null, onComplete);
    }

    public void chunk(ChatMessage message) {
        if (onChunk != null) {
            onChunk.accept(message);
        }
    }

    public void complete(StreamMetadata metadata) {
        if (onComplete != null) {
            onComplete.accept(metadata);
        }
    }
}
