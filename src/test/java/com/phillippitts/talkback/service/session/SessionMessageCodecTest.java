package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.exception.ErrorKind;
import com.phillippitts.talkback.exception.ProtocolException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SessionMessageCodecTest {

    private final SessionMessageCodec codec = new SessionMessageCodec();

    @Test
    void decodesFloatAudioFrameWithTimestamp() {
        InboundMessage message = codec.decode(
                "{\"type\":\"audio_frame\",\"samples\":[0.5,-0.25,2.0],\"timestamp\":1200}");

        assertThat(message).isInstanceOf(InboundMessage.AudioFrameMessage.class);
        InboundMessage.AudioFrameMessage frame = (InboundMessage.AudioFrameMessage) message;
        assertThat(frame.samples()).containsExactly(0.5f, -0.25f, 1.0f);
        assertThat(frame.timestampMs()).isEqualTo(1200L);
    }

    @Test
    void decodesInt16SamplesAndLegacyPcm() {
        InboundMessage.AudioFrameMessage frame = (InboundMessage.AudioFrameMessage) codec.decode(
                "{\"type\":\"audio_frame\",\"encoding\":\"int16\",\"samples\":[16384,-32768]}");
        InboundMessage.AudioFrameMessage pcm = (InboundMessage.AudioFrameMessage) codec.decode(
                "{\"type\":\"pcm\",\"data\":[0.1,0.2]}");

        assertThat(frame.samples()[0]).isCloseTo(0.5f, within(1e-6f));
        assertThat(frame.samples()[1]).isCloseTo(-1.0f, within(1e-6f));
        assertThat(frame.timestampMs()).isNull();
        assertThat(pcm.samples()).containsExactly(0.1f, 0.2f);
    }

    @Test
    void decodesTextPromptWithNestedData() {
        InboundMessage message = codec.decode(
                "{\"type\":\"text_prompt\",\"data\":{\"text\":\"Hallo\",\"voice\":\"de-DE-Chirp3-HD-Charon\","
                        + "\"language_code\":\"de-DE\"}}");

        assertThat(message).isEqualTo(new InboundMessage.TextPrompt("Hallo", "de-DE-Chirp3-HD-Charon", "de-DE"));
    }

    @Test
    void decodesLegacyStartTranscription() {
        InboundMessage message = codec.decode(
                "{\"type\":\"start_transcription\",\"data\":{\"audio_data\":[0.1,0.2],"
                        + "\"language\":\"en-US\",\"metadata\":{\"client\":\"web\",\"n\":3}}}");

        InboundMessage.StartTurn start = (InboundMessage.StartTurn) message;
        assertThat(start.samples()).containsExactly(0.1f, 0.2f);
        assertThat(start.language()).isEqualTo("en-US");
        assertThat(start.voice()).isNull();
        assertThat(start.metadata()).containsEntry("client", "web").containsEntry("n", "3");
    }

    @Test
    void decodesStopMessagesAndLegacyNames() {
        assertThat(codec.decode("{\"type\":\"stop_turn\",\"id\":\"t-1\",\"reason\":\"genug\"}"))
                .isEqualTo(new InboundMessage.StopTurn("t-1", "genug"));
        assertThat(codec.decode("{\"type\":\"stop_transcription\",\"process_id\":\"t-2\"}"))
                .isEqualTo(new InboundMessage.StopTurn("t-2", null));
        assertThat(codec.decode("{\"type\":\"stop_all_transcriptions\"}"))
                .isEqualTo(new InboundMessage.StopAll(null));
        assertThat(codec.decode("{\"type\":\"end_audio\"}")).isInstanceOf(InboundMessage.EndAudio.class);
    }

    @Test
    void rejectsMalformedMessages() {
        assertThatThrownBy(() -> codec.decode("not json"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> codec.decode(" "))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decode("{\"samples\":[]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("no type");
        assertThatThrownBy(() -> codec.decode("{\"type\":\"dance\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("dance");
    }

    @Test
    void rejectsInvalidFields() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"audio_frame\"}"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decode("{\"type\":\"audio_frame\",\"samples\":[\"x\"]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("not a number");
        assertThatThrownBy(() -> codec.decode("{\"type\":\"audio_frame\",\"encoding\":\"mulaw\",\"samples\":[1]}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("mulaw");
        assertThatThrownBy(() -> codec.decode("{\"type\":\"start_turn\",\"samples\":[]}"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decode("{\"type\":\"stop_turn\"}"))
                .isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decode("{\"type\":\"text_prompt\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("text");
    }

    @Test
    void encodesAudioChunkWithSampleArray() {
        String encoded = codec.encode(
                OutboundMessage.audioChunk("t-1", 1, 24_000, new short[] {1, -2, 3}, "Hallo,"));

        JSONObject json = new JSONObject(encoded);
        assertThat(json.getString("type")).isEqualTo("audio_chunk");
        assertThat(json.getString("turn_id")).isEqualTo("t-1");
        assertThat(json.getInt("chunk_number")).isEqualTo(1);
        assertThat(json.getInt("sample_rate")).isEqualTo(24_000);
        assertThat(json.getJSONArray("samples").toList()).containsExactly(1, -2, 3);
        assertThat(json.getString("text")).isEqualTo("Hallo,");
    }

    @Test
    void encodesControlMessagesWithoutTurnId() {
        JSONObject stopped = new JSONObject(codec.encode(OutboundMessage.turnStopped("t-9", false)));
        JSONObject error = new JSONObject(codec.encode(
                OutboundMessage.turnError(null, ErrorKind.TURN_CONFLICT, "A turn is already active")));

        assertThat(stopped.has("turn_id")).isFalse();
        assertThat(stopped.getString("id")).isEqualTo("t-9");
        assertThat(stopped.getBoolean("stopped")).isFalse();
        assertThat(error.getString("kind")).isEqualTo("turn_conflict");
        assertThat(error.getString("error")).isEqualTo("A turn is already active");
    }
}
