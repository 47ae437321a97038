/**
 * Voice activity detection: a pluggable frame classifier and the per-session detector
 * that turns classified frames into speech segments.
 */
package com.phillippitts.talkback.service.vad;
