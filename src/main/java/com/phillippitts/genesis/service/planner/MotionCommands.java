package com.phillippitts.genesis.service.planner;

/**
 * Motion tokens carried by an {@link com.phillippitts.genesis.domain.ActionPlan}.
 *
 * <p>Tokens are symbolic. Only {@code Posture:<name>} names a concrete posture; every other
 * non-neutral token falls back to {@link #DEFAULT_POSTURE}.
 */
public final class MotionCommands {

    /** Neutral head position; no motion channel is started. */
    public static final String NEUTRAL = "HeadYaw:0";
    public static final String JOY = "BodyLanguage:Joy";
    public static final String THINK = "BodyLanguage:Think";
    public static final String NOD = "HeadNod";

    static final String POSTURE_PREFIX = "Posture:";
    static final String DEFAULT_POSTURE = "Stand";

    private MotionCommands() {
    }

    /**
     * {@code true} when the token asks for motion: non-blank and not {@link #NEUTRAL}.
     */
    public static boolean isActive(String motion) {
        return motion != null && !motion.isBlank() && !NEUTRAL.equals(motion);
    }

    /**
     * Posture to move to for an active token.
     */
    public static String postureFor(String motion) {
        if (motion != null && motion.startsWith(POSTURE_PREFIX)) {
            String posture = motion.substring(POSTURE_PREFIX.length()).trim();
            if (!posture.isEmpty()) {
                return posture;
            }
        }
        return DEFAULT_POSTURE;
    }
}
