package com.phillippitts.talkback.service.orchestration;

/**
 * Runs turns: transcribe (audio input), generate, chunk and synthesize.
 */
public interface TurnOrchestrator {

    /**
     * Registers a new turn and returns its event stream. No external call happens until the
     * stream is pulled.
     */
    TurnStream startTurn(TurnRequest request);
}
