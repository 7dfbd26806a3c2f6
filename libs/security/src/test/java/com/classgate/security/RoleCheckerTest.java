package com.classgate.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.classgate.security.testing.TestAuthContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    @Nested
    @DisplayName("hasRole()")
    class HasRole {

        @Test
        @DisplayName("returns true for the exact role")
        void exactRole() {
            assertThat(RoleChecker.hasRole(TestAuthContextFactory.student(), Role.STUDENT)).isTrue();
        }

        @Test
        @DisplayName("ADMIN does not imply INSTRUCTOR")
        void noHierarchy() {
            assertThat(RoleChecker.hasRole(TestAuthContextFactory.admin(), Role.INSTRUCTOR)).isFalse();
        }
    }

    @Nested
    @DisplayName("hasAnyRole()")
    class HasAnyRole {

        @Test
        @DisplayName("returns true when the role is listed")
        void listed() {
            var ctx = TestAuthContextFactory.instructor();
            assertThat(RoleChecker.hasAnyRole(ctx, Role.ADMIN, Role.INSTRUCTOR)).isTrue();
        }

        @Test
        @DisplayName("returns false when the role is not listed")
        void notListed() {
            var ctx = TestAuthContextFactory.student();
            assertThat(RoleChecker.hasAnyRole(ctx, Role.ADMIN, Role.INSTRUCTOR)).isFalse();
        }

        @Test
        @DisplayName("an empty list admits nobody")
        void emptyList() {
            assertThat(RoleChecker.hasAnyRole(TestAuthContextFactory.admin())).isFalse();
        }
    }
}
