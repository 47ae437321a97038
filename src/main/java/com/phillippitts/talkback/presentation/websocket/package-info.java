/**
 * WebSocket transport for voice sessions.
 */
package com.phillippitts.talkback.presentation.websocket;
