package com.patina.orchestrator.tool;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds and renews credentials for every registered tool server.
 * Tokens live in memory only and are never logged.
 */
@Component
public class AuthCoordinator {

    private final Map<String, AuthState> states = new ConcurrentHashMap<>();
    private final Clock clock;

    public AuthCoordinator() {
        this(Clock.systemUTC());
    }

    public AuthCoordinator(Clock clock) {
        this.clock = clock;
    }

    public Optional<AuthState> stateFor(String server) {
        return Optional.ofNullable(states.get(server));
    }

    /** Return valid credentials for {@code server}, refreshing them when they are about to expire. */
    public AuthState negotiate(String server, AuthMode mode) {
        return states.compute(server, (key, current) -> {
            AuthState state = current == null ? AuthState.empty(mode) : current;
            return state.needsRefresh(clock.instant()) ? state.refreshed(mode, clock.instant()) : state;
        });
    }

    public AuthState require(String server) {
        return stateFor(server).orElseThrow(() -> OrchestratorException.of(ErrorKind.TOOL,
                ErrorCodes.UNAUTHORIZED, "no auth state registered for " + server));
    }
}
