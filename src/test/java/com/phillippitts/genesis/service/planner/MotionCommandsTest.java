package com.phillippitts.genesis.service.planner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MotionCommandsTest {

    @Test
    void shouldTreatNeutralAndBlankAsInactive() {
        assertThat(MotionCommands.isActive(MotionCommands.NEUTRAL)).isFalse();
        assertThat(MotionCommands.isActive("")).isFalse();
        assertThat(MotionCommands.isActive(null)).isFalse();
        assertThat(MotionCommands.isActive(MotionCommands.NOD)).isTrue();
    }

    @Test
    void shouldMapPostureTokensToPosture() {
        assertThat(MotionCommands.postureFor("Posture:Crouch")).isEqualTo("Crouch");
        assertThat(MotionCommands.postureFor("Posture:  ")).isEqualTo("Stand");
    }

    @Test
    void shouldFallBackToStandForSymbolicTokens() {
        assertThat(MotionCommands.postureFor(MotionCommands.THINK)).isEqualTo("Stand");
        assertThat(MotionCommands.postureFor(MotionCommands.JOY)).isEqualTo("Stand");
        assertThat(MotionCommands.postureFor(MotionCommands.NOD)).isEqualTo("Stand");
    }
}
