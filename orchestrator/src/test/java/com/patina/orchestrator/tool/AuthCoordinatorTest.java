package com.patina.orchestrator.tool;

import com.patina.orchestrator.error.OrchestratorException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthCoordinatorTest {

    static class MutableClock extends Clock {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    MutableClock    clock = new MutableClock();
    AuthCoordinator auth  = new AuthCoordinator(clock);

    @Test
    void negotiate_reusesValidToken() {
        AuthState first = auth.negotiate("fs", AuthMode.SERVER_MANAGED);
        AuthState second = auth.negotiate("fs", AuthMode.SERVER_MANAGED);

        assertThat(second.accessToken()).isEqualTo(first.accessToken());
        assertThat(first.refreshToken()).isNull();
    }

    @Test
    void negotiate_refreshesNearExpiry() {
        AuthState first = auth.negotiate("tracker", AuthMode.CLIENT_MANAGED);
        clock.now = clock.now.plus(Duration.ofMinutes(29).plusSeconds(30));

        AuthState renewed = auth.negotiate("tracker", AuthMode.CLIENT_MANAGED);

        assertThat(renewed.accessToken()).isNotEqualTo(first.accessToken());
        assertThat(renewed.refreshToken()).isNotNull();
    }

    @Test
    void toString_neverShowsTokens() {
        AuthState state = auth.negotiate("fs", AuthMode.SERVER_MANAGED);

        assertThat(state.toString()).doesNotContain(state.accessToken());
    }

    @Test
    void require_unknownServer_isUnauthorized() {
        assertThatThrownBy(() -> auth.require("nope")).isInstanceOf(OrchestratorException.class);
    }
}
