/**
 * Logging infrastructure: MDC population for HTTP requests.
 */
package com.phillippitts.talkback.config.logging;
