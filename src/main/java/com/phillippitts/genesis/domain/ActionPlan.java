package com.phillippitts.genesis.domain;

/**
 * Output for one turn: what to say and which motion token to play alongside it.
 *
 * @param speech text to speak (may be empty)
 * @param motion opaque motion token, e.g. {@code HeadNod} or {@code Posture:Crouch}
 */
public record ActionPlan(String speech, String motion) {

    public ActionPlan {
        speech = speech == null ? "" : speech;
        motion = motion == null ? "" : motion;
    }

    public boolean hasSpeech() {
        return !speech.isBlank();
    }
}
