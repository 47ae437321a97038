/**
 * Session layer: the JSON message protocol and per-connection {@link
 * com.phillippitts.talkback.service.session.VoiceSession} lifecycle.
 */
package com.phillippitts.talkback.service.session;
