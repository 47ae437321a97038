/**
 * Micrometer instrumentation for turns and speech detection.
 */
package com.phillippitts.talkback.service.metrics;
