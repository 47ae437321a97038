/**
 * Immutable domain types shared by the voice activity detector, the synthesis chunker
 * and the turn orchestrator.
 */
package com.phillippitts.talkback.domain;
