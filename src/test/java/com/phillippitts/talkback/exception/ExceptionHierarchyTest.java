package com.phillippitts.talkback.exception;

import com.phillippitts.talkback.domain.SpeechSegment;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void talkBackExceptionShouldDefaultToInternal() {
        TalkBackException ex = new TalkBackException("test error");

        assertThat(ex.getMessage()).isEqualTo("test error");
        assertThat(ex.getErrorKind()).isEqualTo(ErrorKind.INTERNAL);
    }

    @Test
    void talkBackExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        TalkBackException ex = new TalkBackException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void transcriptionExceptionShouldIncludeAdapterName() {
        TranscriptionException ex = new TranscriptionException("timeout occurred", "google-speech");

        assertThat(ex.getMessage()).contains("timeout occurred").contains("google-speech");
        assertThat(ex.getAdapterName()).isEqualTo("google-speech");
        assertThat(ex.getErrorKind()).isEqualTo(ErrorKind.TRANSCRIPTION);
        assertThat(new TranscriptionException("failed").getAdapterName()).isEqualTo("unknown");
    }

    @Test
    void transcriptionExceptionBuilderShouldFormatContext() {
        IOException cause = new IOException("reset");
        TranscriptionException ex = TranscriptionExceptionBuilder.create("Request failed")
                .adapter("google-speech")
                .cause(cause)
                .language("de-DE")
                .segment(new SpeechSegment(new float[24_000], 16_000, 0, 1_200))
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage()).isEqualTo(
                "Request failed (language=de-DE, segmentMs=1500, sampleRate=16000) (adapter: google-speech)");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void transcriptionExceptionBuilderShouldFallBackToUnknownAdapter() {
        TranscriptionException ex = TranscriptionExceptionBuilder.create("No result").adapter(" ").build();

        assertThat(ex.getMessage()).isEqualTo("No result (adapter: unknown)");
        assertThat(ex.getAdapterName()).isEqualTo("unknown");
    }

    @Test
    void synthesisExceptionShouldKeepSpan() {
        SynthesisException ex = new SynthesisException("voice rejected", "Hallo.");

        assertThat(ex.getSpan()).isEqualTo("Hallo.");
        assertThat(ex.getErrorKind()).isEqualTo(ErrorKind.SYNTHESIS);
    }

    @Test
    void kindsShouldMatchTheirFailures() {
        assertThat(new GenerationException("overloaded").getErrorKind()).isEqualTo(ErrorKind.GENERATION);
        assertThat(new InvalidTurnInputException("text", "empty").getErrorKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(new ProtocolException("bad").getErrorKind()).isEqualTo(ErrorKind.PROTOCOL);
        assertThat(new TurnConflictException("t-1").getErrorKind()).isEqualTo(ErrorKind.TURN_CONFLICT);
        assertThat(new TurnNotFoundException("t-1").getErrorKind()).isEqualTo(ErrorKind.INTERNAL);
    }

    @Test
    void turnConflictShouldNameActiveTurnWhenKnown() {
        assertThat(new TurnConflictException("t-1").getMessage()).isEqualTo("A turn is already active: t-1");
        assertThat(new TurnConflictException(null).getMessage()).isEqualTo("A turn is already active");
    }

    @Test
    void wireNamesShouldStayStable() {
        assertThat(ErrorKind.TRANSCRIPTION.wireName()).isEqualTo("transcription_failed");
        assertThat(ErrorKind.GENERATION.wireName()).isEqualTo("generation_failed");
        assertThat(ErrorKind.SYNTHESIS.wireName()).isEqualTo("synthesis_failed");
        assertThat(ErrorKind.VALIDATION.wireName()).isEqualTo("validation");
        assertThat(ErrorKind.TURN_CONFLICT.wireName()).isEqualTo("turn_conflict");
        assertThat(ErrorKind.PROTOCOL.wireName()).isEqualTo("protocol");
        assertThat(ErrorKind.INTERNAL.wireName()).isEqualTo("internal");
        assertThat(ErrorKind.TURN_CONFLICT.tag()).isEqualTo("turn_conflict");
    }
}
