package org.operaton.fitjourney.security;

import org.operaton.fitjourney.exception.NotLoggedInException;

import java.util.Optional;

/**
 * Source of the signed-in user's id. Backed by the external auth provider.
 */
public interface CurrentUserProvider {

    /**
     * @return the id of the signed-in user, or empty when nobody is signed in
     */
    Optional<String> currentUserId();

    /**
     * @return the id of the signed-in user
     * @throws NotLoggedInException when nobody is signed in
     */
    default String requireUserId() {
        return currentUserId().orElseThrow(NotLoggedInException::new);
    }
}
