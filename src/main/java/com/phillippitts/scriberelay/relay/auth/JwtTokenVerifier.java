package com.phillippitts.scriberelay.relay.auth;

import com.phillippitts.scriberelay.config.relay.RelayProperties;
import com.phillippitts.scriberelay.exception.AuthenticationFailedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.stereotype.Component;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * HS256 JWT verification against a shared secret. The {@code sub} claim is the user id;
 * expiry is enforced by the decoder's default validators.
 *
 * <p>Failure reasons are logged by category only; token contents never reach the log.
 */
@Component
public class JwtTokenVerifier implements TokenVerifier {

    private static final Logger LOG = LogManager.getLogger(JwtTokenVerifier.class);

    private final JwtDecoder decoder;

    @org.springframework.beans.factory.annotation.Autowired
    public JwtTokenVerifier(RelayProperties props) {
        this(props.getJwtSecret());
    }

    // Package-private for tests
    JwtTokenVerifier(String secret) {
        if (secret == null || secret.isBlank()) {
            LOG.warn("No JWT secret configured (relay.jwt-secret); every auth attempt will be rejected");
            this.decoder = null;
        } else {
            SecretKeySpec key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            this.decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        }
    }

    @Override
    public VerifiedUser verify(String accessToken) {
        if (decoder == null) {
            throw new AuthenticationFailedException("Authentication failed");
        }
        if (accessToken == null || accessToken.isBlank()) {
            LOG.info("Auth rejected: token missing");
            throw new AuthenticationFailedException("Authentication failed");
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(accessToken);
        } catch (JwtValidationException e) {
            LOG.info("Auth rejected: token expired or not yet valid");
            throw new AuthenticationFailedException("Authentication failed", e);
        } catch (BadJwtException e) {
            LOG.info("Auth rejected: invalid signature or format");
            throw new AuthenticationFailedException("Authentication failed", e);
        } catch (JwtException e) {
            LOG.warn("Auth rejected: verification error ({})", e.getClass().getSimpleName());
            throw new AuthenticationFailedException("Authentication failed", e);
        }
        String subject = jwt.getSubject();
        if (subject == null || subject.isBlank()) {
            LOG.info("Auth rejected: token missing sub claim");
            throw new AuthenticationFailedException("Authentication failed");
        }
        return new VerifiedUser(subject);
    }
}
