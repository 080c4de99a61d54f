package com.phillippitts.streamscribe.service.session;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Transcription model requested when a real-time session is created.
 */
public enum TranscriptionModel {
    SPEED("speed"),
    QUALITY("quality"),
    QUALITY_V2("quality_v2");

    private final String wireName;

    TranscriptionModel(String wireName) {
        this.wireName = wireName;
    }

    /** Name sent to the session service. */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a model name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a supported model
     */
    public static TranscriptionModel parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TranscriptionModel model : values()) {
                if (model.wireName.equals(normalized)) {
                    return model;
                }
            }
        }
        String supported = Arrays.stream(values())
                .map(m -> "'" + m.wireName + "'")
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unsupported model '" + value + "' (expected one of " + supported + ")");
    }
}
