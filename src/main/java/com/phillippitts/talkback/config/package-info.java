/**
 * Spring wiring: thread pools, collaborator defaults, turn pipeline and WebSocket endpoint.
 */
package com.phillippitts.talkback.config;
