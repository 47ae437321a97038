/**
 * Application event listeners that turn pipeline outcomes into operator-facing log lines.
 */
package com.phillippitts.talkback.service.events;
