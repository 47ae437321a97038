/**
 * Actuator health indicators.
 */
package com.phillippitts.talkback.service.health;
