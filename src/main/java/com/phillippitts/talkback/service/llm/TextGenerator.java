package com.phillippitts.talkback.service.llm;

import com.phillippitts.talkback.service.cancel.CancellationToken;
import com.phillippitts.talkback.service.stream.PullStream;

/**
 * Streaming text generation collaborator.
 *
 * <p>The returned stream yields text fragments in order and ends with end of stream, or with an
 * error result if generation fails part way. It should stop producing once {@code token} is
 * cancelled or the stream is closed. {@link com.phillippitts.talkback.service.stream.QueueStream}
 * is the usual bridge for adapters built on a blocking or callback client.
 */
public interface TextGenerator {

    /**
     * Starts generating.
     *
     * @param prompt full prompt text
     * @param token  turn cancellation
     * @return lazy fragment stream
     * @throws com.phillippitts.talkback.exception.GenerationException if the request cannot be started
     */
    PullStream<String> generate(String prompt, CancellationToken token);

    String getName();

    boolean isAvailable();
}
