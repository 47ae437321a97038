package com.phillippitts.talkback.service.session;

import com.phillippitts.talkback.exception.ProtocolException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * JSON codec for the session protocol.
 *
 * <p>Inbound messages are objects with a {@code type} field. Field values may also be nested
 * under a {@code data} object, and a few legacy names are accepted:
 * <ul>
 *   <li>{@code pcm{data: [...]}} for {@code audio_frame{samples: [...]}}</li>
 *   <li>{@code audio_data} for {@code samples}, {@code process_id} for {@code id}</li>
 *   <li>{@code start_transcription}, {@code stop_transcription}, {@code stop_all_transcriptions}
 *       for {@code start_turn}, {@code stop_turn}, {@code stop_all}</li>
 * </ul>
 *
 * <p>Samples are floats in [-1, 1] unless {@code encoding} is {@code int16}.
 */
@Component
public class SessionMessageCodec {

    private static final float INT16_SCALE = 32768f;

    /**
     * @throws ProtocolException for malformed JSON, unknown types or missing/invalid fields
     */
    public InboundMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty message");
        }
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new ProtocolException("Malformed JSON message", e);
        }
        String type = json.optString("type", null);
        if (type == null || type.isBlank()) {
            throw new ProtocolException("Message has no type");
        }
        JSONObject data = json.optJSONObject("data");
        return switch (type) {
            case "audio_frame" -> new InboundMessage.AudioFrameMessage(
                    samples(json, data, "samples", true), timestamp(json));
            case "pcm" -> new InboundMessage.AudioFrameMessage(pcmSamples(json), timestamp(json));
            case "end_audio" -> new InboundMessage.EndAudio();
            case "text_prompt" -> new InboundMessage.TextPrompt(
                    requiredString(json, data, "text"),
                    string(json, data, "voice"),
                    firstNonNull(string(json, data, "language"), string(json, data, "language_code")));
            case "start_turn", "start_transcription" -> new InboundMessage.StartTurn(
                    startTurnSamples(json, data),
                    firstNonNull(string(json, data, "language"), string(json, data, "language_code")),
                    string(json, data, "voice"),
                    metadata(json, data));
            case "stop_turn", "stop_transcription" -> new InboundMessage.StopTurn(
                    requiredId(json, data), string(json, data, "reason"));
            case "stop_all", "stop_all_transcriptions" -> new InboundMessage.StopAll(string(json, data, "reason"));
            default -> throw new ProtocolException("Unknown message type: " + type);
        };
    }

    public String encode(OutboundMessage message) {
        JSONObject json = new JSONObject();
        json.put("type", message.type());
        if (message.turnId() != null) {
            json.put("turn_id", message.turnId());
        }
        for (Map.Entry<String, Object> field : message.payload().entrySet()) {
            Object value = field.getValue();
            if (value instanceof short[] samples) {
                JSONArray array = new JSONArray();
                for (short sample : samples) {
                    array.put(sample);
                }
                json.put(field.getKey(), array);
            } else {
                json.put(field.getKey(), value);
            }
        }
        return json.toString();
    }

    private static float[] pcmSamples(JSONObject json) {
        JSONArray array = json.optJSONArray("data");
        if (array == null) {
            throw new ProtocolException("pcm message needs a 'data' sample array");
        }
        return toSamples(array, json.optString("encoding", "float"));
    }

    private static float[] startTurnSamples(JSONObject json, JSONObject data) {
        float[] samples = samples(json, data, "samples", false);
        if (samples == null) {
            samples = samples(json, data, "audio_data", false);
        }
        if (samples == null || samples.length == 0) {
            throw new ProtocolException("start_turn needs a non-empty 'samples' array");
        }
        return samples;
    }

    private static float[] samples(JSONObject json, JSONObject data, String field, boolean required) {
        JSONArray array = json.optJSONArray(field);
        if (array == null && data != null) {
            array = data.optJSONArray(field);
        }
        if (array == null) {
            if (required) {
                throw new ProtocolException("Missing sample array '" + field + "'");
            }
            return null;
        }
        String encoding = firstNonNull(string(json, data, "encoding"), "float");
        return toSamples(array, encoding);
    }

    private static float[] toSamples(JSONArray array, String encoding) {
        boolean int16;
        if ("int16".equals(encoding)) {
            int16 = true;
        } else if ("float".equals(encoding)) {
            int16 = false;
        } else {
            throw new ProtocolException("Unsupported sample encoding: " + encoding);
        }
        float[] samples = new float[array.length()];
        for (int i = 0; i < samples.length; i++) {
            double value;
            try {
                value = array.getDouble(i);
            } catch (JSONException e) {
                throw new ProtocolException("Sample " + i + " is not a number", e);
            }
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ProtocolException("Sample " + i + " is not finite");
            }
            float sample = int16 ? (float) (value / INT16_SCALE) : (float) value;
            samples[i] = Math.max(-1f, Math.min(1f, sample));
        }
        return samples;
    }

    private static Long timestamp(JSONObject json) {
        if (!json.has("timestamp") || json.isNull("timestamp")) {
            return null;
        }
        try {
            return json.getLong("timestamp");
        } catch (JSONException e) {
            throw new ProtocolException("timestamp must be a number", e);
        }
    }

    private static String requiredId(JSONObject json, JSONObject data) {
        String id = firstNonNull(string(json, data, "id"), string(json, data, "process_id"));
        if (id == null || id.isBlank()) {
            throw new ProtocolException("stop_turn needs an 'id'");
        }
        return id;
    }

    private static String requiredString(JSONObject json, JSONObject data, String field) {
        String value = string(json, data, field);
        if (value == null) {
            throw new ProtocolException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String string(JSONObject json, JSONObject data, String field) {
        if (json.has(field) && !json.isNull(field)) {
            return String.valueOf(json.get(field));
        }
        if (data != null && data.has(field) && !data.isNull(field)) {
            return String.valueOf(data.get(field));
        }
        return null;
    }

    private static Map<String, String> metadata(JSONObject json, JSONObject data) {
        JSONObject meta = json.optJSONObject("metadata");
        if (meta == null && data != null) {
            meta = data.optJSONObject("metadata");
        }
        Map<String, String> result = new HashMap<>();
        if (meta != null) {
            for (String key : meta.keySet()) {
                if (!meta.isNull(key)) {
                    result.put(key, String.valueOf(meta.get(key)));
                }
            }
        }
        return result;
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
