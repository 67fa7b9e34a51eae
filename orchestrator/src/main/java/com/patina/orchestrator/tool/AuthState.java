package com.patina.orchestrator.tool;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Credentials held for one tool server. Immutable; refreshing returns a new state.
 */
public record AuthState(AuthMode mode, String accessToken, String refreshToken, Instant expiresAt) {

    static final Duration REFRESH_MARGIN        = Duration.ofMinutes(1);
    static final Duration SERVER_MANAGED_TTL    = Duration.ofHours(1);
    static final Duration CLIENT_MANAGED_TTL    = Duration.ofMinutes(30);

    public static AuthState empty(AuthMode mode) {
        return new AuthState(mode, null, null, null);
    }

    /** True when there is no token or it expires within the next minute. */
    public boolean needsRefresh(Instant now) {
        if (accessToken == null) {
            return true;
        }
        return expiresAt != null && !now.plus(REFRESH_MARGIN).isBefore(expiresAt);
    }

    public AuthState refreshed(AuthMode newMode, Instant now) {
        return switch (newMode) {
            case SERVER_MANAGED -> new AuthState(newMode,
                    "server-token-" + UUID.randomUUID(), null, now.plus(SERVER_MANAGED_TTL));
            case CLIENT_MANAGED -> new AuthState(newMode,
                    "client-token-" + UUID.randomUUID(), "refresh-" + UUID.randomUUID(),
                    now.plus(CLIENT_MANAGED_TTL));
        };
    }

    @Override
    public String toString() {
        return "AuthState[mode=" + mode + ", expiresAt=" + expiresAt + "]";
    }
}
