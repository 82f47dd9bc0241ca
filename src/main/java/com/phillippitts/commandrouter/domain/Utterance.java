package com.phillippitts.commandrouter.domain;

import java.util.Objects;

/**
 * Raw command text as received from a client.
 *
 * @param text   the utterance, trimmed, never blank
 * @param origin whether the text was typed or produced by speech transcription
 */
public record Utterance(String text, Origin origin) {

    public enum Origin { TYPED, TRANSCRIBED }

    public Utterance {
        Objects.requireNonNull(text, "Utterance text must not be null");
        text = text.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Utterance text must not be blank");
        }
        if (origin == null) {
            origin = Origin.TYPED;
        }
    }

    public static Utterance typed(String text) {
        return new Utterance(text, Origin.TYPED);
    }
}
