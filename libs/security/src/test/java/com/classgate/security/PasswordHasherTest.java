package com.classgate.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PasswordHasher")
class PasswordHasherTest {

    // Lowest cost keeps the suite fast; the algorithm is the same at any cost.
    private final PasswordHasher hasher = new PasswordHasher(4);

    @Nested
    @DisplayName("hash()")
    class Hash {

        @Test
        @DisplayName("produces a bcrypt digest that is not the plaintext")
        void producesDigest() {
            String digest = hasher.hash("Passw0rd");
            assertThat(digest).startsWith("$2b$04$").hasSize(60).doesNotContain("Passw0rd");
        }

        @Test
        @DisplayName("salts every call: two digests differ yet both verify")
        void saltsEveryCall() {
            String first = hasher.hash("Passw0rd");
            String second = hasher.hash("Passw0rd");

            assertThat(first).isNotEqualTo(second);
            assertThat(hasher.verify("Passw0rd", first)).isTrue();
            assertThat(hasher.verify("Passw0rd", second)).isTrue();
        }

        @Test
        @DisplayName("rejects empty and null plaintext")
        void rejectsEmpty() {
            assertThatThrownBy(() -> hasher.hash("")).isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("rejects plaintext over 72 bytes, counting UTF-8 bytes")
        void rejectsOversized() {
            assertThatThrownBy(() -> hasher.hash("a".repeat(73)))
                    .isInstanceOf(InvalidInputException.class);
            // 37 two-byte characters = 74 bytes
            assertThatThrownBy(() -> hasher.hash("é".repeat(37)))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(hasher.hash("a".repeat(72))).isNotBlank();
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("returns false for a different password")
        void differentPassword() {
            String digest = hasher.hash("Passw0rd");
            assertThat(hasher.verify("Passw0rd!", digest)).isFalse();
            assertThat(hasher.verify("passw0rd", digest)).isFalse();
        }

        @Test
        @DisplayName("returns false rather than throwing for empty or oversized plaintext")
        void emptyOrOversized() {
            String digest = hasher.hash("Passw0rd");
            assertThat(hasher.verify("", digest)).isFalse();
            assertThat(hasher.verify(null, digest)).isFalse();
            assertThat(hasher.verify("a".repeat(100), digest)).isFalse();
        }

        @Test
        @DisplayName("verifies digests produced at a different cost")
        void differentCost() {
            String digest = new PasswordHasher(5).hash("Passw0rd");
            assertThat(hasher.verify("Passw0rd", digest)).isTrue();
        }

        @Test
        @DisplayName("throws CorruptDigestException for malformed digests")
        void malformedDigest() {
            assertThatThrownBy(() -> hasher.verify("Passw0rd", "plaintext-password"))
                    .isInstanceOf(CorruptDigestException.class);
            assertThatThrownBy(() -> hasher.verify("Passw0rd", "$1$04$abcdefghijklmnopqrstuv"))
                    .isInstanceOf(CorruptDigestException.class);
            assertThatThrownBy(() -> hasher.verify("Passw0rd", null))
                    .isInstanceOf(CorruptDigestException.class);
        }

        @Test
        @DisplayName("throws CorruptDigestException for an out-of-range cost")
        void invalidCost() {
            String digest = hasher.hash("Passw0rd");
            String tampered = "$2b$99$" + digest.substring(7);
            assertThatThrownBy(() -> hasher.verify("Passw0rd", tampered))
                    .isInstanceOf(CorruptDigestException.class);
        }
    }

    @Nested
    @DisplayName("needsRehash()")
    class NeedsRehash {

        @Test
        @DisplayName("true only for digests below the configured work factor")
        void belowWorkFactor() {
            String cheap = hasher.hash("Passw0rd");
            PasswordHasher stronger = new PasswordHasher(5);

            assertThat(stronger.needsRehash(cheap)).isTrue();
            assertThat(hasher.needsRehash(cheap)).isFalse();
            assertThat(hasher.needsRehash(stronger.hash("Passw0rd"))).isFalse();
        }
    }

    @Test
    @DisplayName("rejects work factors outside 4..31")
    void rejectsInvalidWorkFactor() {
        assertThatThrownBy(() -> new PasswordHasher(3)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new PasswordHasher(32)).isInstanceOf(ConfigurationException.class);
    }
}
