/**
 * Outer surfaces: WebSocket session transport and operator REST API.
 */
package com.phillippitts.talkback.presentation;
