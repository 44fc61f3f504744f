package me.golemcore.tutor.domain.loop;

import me.golemcore.tutor.infrastructure.config.TutorProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AmbiguityGuardTest {

    private final AmbiguityGuard guard = new AmbiguityGuard(new TutorProperties());

    @ParameterizedTest
    @ValueSource(strings = { "hi", "ok", "", "   ", "What?", "help me please", "Explain this", "what is that?",
            "How   do I?" })
    void shouldFlagShortOrVagueMessages(String message) {
        assertTrue(guard.isAmbiguous(message));
    }

    @ParameterizedTest
    @ValueSource(strings = { "How do I factor x^2 - 1?", "I want to learn algebra",
            "What is the derivative of sin(x)?", "explain photosynthesis" })
    void shouldAcceptSpecificMessages(String message) {
        assertFalse(guard.isAmbiguous(message));
    }

    @Test
    void shouldTreatNullAsAmbiguous() {
        assertTrue(guard.isAmbiguous(null));
    }

    @Test
    void shouldAcceptEverythingWhenDisabled() {
        TutorProperties properties = new TutorProperties();
        properties.getGuard().setEnabled(false);

        assertFalse(new AmbiguityGuard(properties).isAmbiguous("hi"));
    }
}
