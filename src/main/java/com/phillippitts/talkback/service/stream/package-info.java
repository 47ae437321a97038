/**
 * Pull-based streams with tagged outcomes.
 *
 * <p>{@link com.phillippitts.talkback.service.stream.StreamResult} replaces exception-driven
 * control flow for end of stream and cancellation. {@link com.phillippitts.talkback.service.stream.QueueStream}
 * bridges a blocking producer thread to a pulling consumer through a bounded queue.
 */
package com.phillippitts.talkback.service.stream;
