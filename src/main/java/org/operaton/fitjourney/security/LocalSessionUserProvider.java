package org.operaton.fitjourney.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the id the auth provider reported at sign-in for the lifetime of the process.
 */
@Component
@Slf4j
public class LocalSessionUserProvider implements CurrentUserProvider {

    private final AtomicReference<String> userId = new AtomicReference<>();

    @Override
    public Optional<String> currentUserId() {
        return Optional.ofNullable(userId.get());
    }

    public void signIn(String id) {
        userId.set(id);
        log.debug("Local session opened for user {}", id);
    }

    public void signOut() {
        String previous = userId.getAndSet(null);
        if (previous != null) {
            log.debug("Local session closed for user {}", previous);
        }
    }
}
