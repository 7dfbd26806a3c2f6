/**
 * Domain layer: users, the repository port, registration rules and {@link
 * com.classgate.authservice.domain.AuthService}.
 *
 * <p>Nothing in this package depends on Spring, the web layer or a storage engine. Storage is
 * reached only through {@link com.classgate.authservice.domain.UserRepository}; the beans are
 * wired in {@code config}.
 */
package com.classgate.authservice.domain;
