package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.exception.SessionRequestException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses session service responses.
 *
 * <p>The service may return the payload at the root or wrapped in a {@code data} object:
 * <ul>
 *   <li>{@code {"task_id": "...", "session_id": "...", "usage_id": "...", "max_time": 3600}}</li>
 *   <li>{@code {"data": {"task_id": "...", ...}}}</li>
 * </ul>
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * @since 1.0
 */
final class SessionJsonParser {

    private SessionJsonParser() {
        // Utility class - prevent instantiation
    }

    static String createRequest(TranscriptionModel model) {
        return new JSONObject().put("model", model.wireName()).toString();
    }

    static SessionHandle parseCreated(String json) {
        JSONObject obj = payload(json);
        String sessionId = obj.optString("session_id", "");
        String taskId = obj.optString("task_id", "");
        if (sessionId.isBlank() || taskId.isBlank()) {
            throw new SessionRequestException("Session response missing session_id or task_id");
        }
        return new SessionHandle(sessionId, taskId, obj.optString("usage_id", ""), obj.optInt("max_time", 0));
    }

    static SessionCloseResult parseClosed(String json) {
        JSONObject obj = payload(json);
        return new SessionCloseResult(
                obj.optString("status", ""),
                optInteger(obj, "duration"),
                optInteger(obj, "error_code"),
                obj.has("message") && !obj.isNull("message") ? obj.getString("message") : null);
    }

    /** Extracts {@code error_code} from an error body, or {@code null} when absent or unparseable. */
    static Integer errorCode(String json) {
        try {
            return optInteger(payload(json), "error_code");
        } catch (SessionRequestException e) {
            return null;
        }
    }

    private static JSONObject payload(String json) {
        if (json == null || json.isBlank()) {
            throw new SessionRequestException("Empty session service response");
        }
        try {
            JSONObject root = new JSONObject(json);
            JSONObject data = root.optJSONObject("data");
            if (data == null) {
                return root;
            }
            // error fields may sit next to the data object
            for (String key : new String[]{"status", "error_code", "message"}) {
                if (!data.has(key) && root.has(key)) {
                    data.put(key, root.get(key));
                }
            }
            return data;
        } catch (JSONException e) {
            throw new SessionRequestException("Malformed session service response", e);
        }
    }

    private static Integer optInteger(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
