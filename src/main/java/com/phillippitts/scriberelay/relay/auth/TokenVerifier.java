package com.phillippitts.scriberelay.relay.auth;

import com.phillippitts.scriberelay.exception.AuthenticationFailedException;

/**
 * Verifies client access tokens locally, without a network call.
 */
@FunctionalInterface
public interface TokenVerifier {

    /**
     * @throws AuthenticationFailedException if the token is missing, expired, malformed,
     *                                       wrongly signed or has no subject
     */
    VerifiedUser verify(String accessToken);
}
