/**
 * Cooperative cancellation: per-turn tokens, the process registry that lets turns be stopped
 * from outside, and the first-completed-wins race for blocking external calls.
 */
package com.phillippitts.talkback.service.cancel;
