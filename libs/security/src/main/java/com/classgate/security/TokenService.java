package com.classgate.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Signs and verifies time-bounded identity tokens (HS256 JWTs).
 *
 * <p>Tokens are stateless: whether one is valid depends only on its signature and on the clock at
 * verification time. There is no revocation; a token stays usable until it expires.
 *
 * <p>The configured secret is stretched with SHA-256 into the 256-bit key HS256 requires, so any
 * non-blank secret works. Instances are immutable and thread-safe.
 */
public final class TokenService {

    /** Claim carrying the {@link Role} name. */
    public static final String ROLE_CLAIM = "role";

    private final TokenSettings settings;
    private final Clock clock;
    private final JWSSigner signer;
    private final JWSVerifier verifier;

    public TokenService(TokenSettings settings, Clock clock) {
        if (settings == null) {
            throw new ConfigurationException("token settings must be configured");
        }
        if (clock == null) {
            throw new ConfigurationException("clock must not be null");
        }
        this.settings = settings;
        this.clock = clock;
        byte[] key = deriveKey(settings.secret());
        try {
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
        } catch (JOSEException e) {
            throw new ConfigurationException("token signing key could not be initialised");
        }
    }

    /**
     * Issues a token with the configured default lifetime.
     */
    public IssuedToken issue(String subject, Role role) {
        return issue(subject, role, settings.defaultTtl());
    }

    /**
     * Issues a token for {@code subject} that expires at {@code now + ttl}.
     * <p>
     * A zero ttl is accepted and produces a token that is already expired to any later check.
     *
     * @throws ConfigurationException if ttl is null or negative
     */
    public IssuedToken issue(String subject, Role role, Duration ttl) {
        if (ttl == null) {
            throw new ConfigurationException("token ttl must be configured");
        }
        if (ttl.isNegative()) {
            throw new ConfigurationException("token ttl must not be negative, was " + ttl);
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }

        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .jwtID(UUID.randomUUID().toString())
                .issuer(settings.issuer())
                .subject(subject)
                .claim(ROLE_CLAIM, role.name())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .build();

        SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
                claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("token signing failed", e);
        }
        // The serialized exp claim is whole seconds; report what the token actually carries.
        return new IssuedToken(jwt.serialize(), Instant.ofEpochSecond(expiresAt.getEpochSecond()));
    }

    /**
     * Verifies a token's structure, signature and expiry, in that order.
     *
     * @return the claims of a valid token
     * @throws MalformedTokenException   if the token cannot be parsed or lacks required claims
     * @throws InvalidSignatureException if the algorithm is not HS256 or the signature does not match
     * @throws ExpiredTokenException     if the clock is past the token's expiry
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("token is empty");
        }
        if (token.split("\\.", -1).length != 3) {
            throw new MalformedTokenException("token must have exactly three parts");
        }

        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token);
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new MalformedTokenException("token could not be parsed", e);
        }

        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            throw new InvalidSignatureException(
                    "unexpected signing algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(verifier)) {
                throw new InvalidSignatureException("token signature does not match");
            }
        } catch (JOSEException e) {
            throw new InvalidSignatureException("token signature could not be verified", e);
        }

        TokenClaims verified = readClaims(claims);
        if (clock.instant().isAfter(verified.expiresAt())) {
            throw new ExpiredTokenException(verified.expiresAt());
        }
        return verified;
    }

    private static TokenClaims readClaims(JWTClaimsSet claims) {
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new MalformedTokenException("token has no subject");
        }
        String roleName;
        try {
            roleName = claims.getStringClaim(ROLE_CLAIM);
        } catch (ParseException e) {
            throw new MalformedTokenException("token role claim is not a string", e);
        }
        Role role = Role.fromString(roleName)
                .orElseThrow(() -> new MalformedTokenException("token carries an unknown role"));
        Date expiration = claims.getExpirationTime();
        if (expiration == null) {
            throw new MalformedTokenException("token has no expiry");
        }
        Date issued = claims.getIssueTime();
        return new TokenClaims(
                subject,
                role,
                issued != null ? issued.toInstant() : null,
                expiration.toInstant());
    }

    private static byte[] deriveKey(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256")
                    .digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
