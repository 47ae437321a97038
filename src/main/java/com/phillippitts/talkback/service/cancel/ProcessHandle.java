package com.phillippitts.talkback.service.cancel;

/**
 * Returned by {@link ProcessRegistry#start}: the new turn id and its token.
 */
public record ProcessHandle(String id, CancellationToken token) {
}
