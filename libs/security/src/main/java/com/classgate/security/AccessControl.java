package com.classgate.security;

import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request-level authorization: turns an Authorization header into an {@link AuthContext} and
 * gates operations by role.
 *
 * <p>{@link #authenticate(String)} is a pure function of the header and the clock; it returns the
 * context instead of attaching it anywhere, so each request threads its own value through the call
 * chain. {@link #requireRole(AuthContext, Role...)} only ever sees contexts that came out of
 * {@code authenticate}.
 */
public final class AccessControl {

    private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

    private final TokenService tokenService;

    public AccessControl(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    /**
     * Extracts and verifies the bearer token carried in an Authorization header value.
     *
     * @param authorizationHeader raw header value (may be null)
     * @return the identity asserted by the token
     * @throws MissingTokenException if the header carries no bearer token
     * @throws AuthenticationException the specific token failure from {@link TokenService#verify}
     */
    public AuthContext authenticate(String authorizationHeader) {
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(MissingTokenException::new);
        try {
            return tokenService.verify(token).toAuthContext();
        } catch (AuthenticationException e) {
            log.debug("Bearer token rejected: {}", e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * Checks that the context's role is one of {@code allowedRoles}.
     *
     * @throws ForbiddenException if it is not
     */
    public void requireRole(AuthContext context, Role... allowedRoles) {
        if (!RoleChecker.hasAnyRole(context, allowedRoles)) {
            throw new ForbiddenException(context.role(), Arrays.asList(allowedRoles));
        }
    }
}
