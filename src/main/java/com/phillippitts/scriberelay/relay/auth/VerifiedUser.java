package com.phillippitts.scriberelay.relay.auth;

import java.util.Objects;

/**
 * Identity extracted from a verified access token.
 *
 * @param userId the token subject
 */
public record VerifiedUser(String userId) {

    public VerifiedUser {
        Objects.requireNonNull(userId, "userId must not be null");
    }
}
