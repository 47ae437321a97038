/**
 * Turn orchestration: one cancellable, ordered transcribe → generate → synthesize pipeline per
 * turn, plus the per-session pieces it reads (history, voice policy, turn gate).
 */
package com.phillippitts.talkback.service.orchestration;
