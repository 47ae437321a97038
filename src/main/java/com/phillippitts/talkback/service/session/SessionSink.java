package com.phillippitts.talkback.service.session;

/**
 * Outbound side of a session's transport.
 *
 * <p>Called from the session's inbound thread and from its turn worker, so implementations must
 * be thread-safe. They must not throw: a message that cannot be delivered is logged and dropped.
 */
@FunctionalInterface
public interface SessionSink {

    /**
     * @return {@code false} when the message could not be delivered
     */
    boolean send(OutboundMessage message);
}
