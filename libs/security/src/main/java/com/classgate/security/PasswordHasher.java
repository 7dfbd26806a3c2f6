package com.classgate.security;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.security.crypto.bcrypt.BCrypt;

/**
 * One-way password hashing and verification with bcrypt.
 *
 * <p>Every call to {@link #hash(String)} draws a fresh salt, so hashing the same password twice
 * yields two different digests that both verify. The work factor (bcrypt log-rounds) is fixed at
 * construction; raising it later is picked up by {@link #needsRehash(String)}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class PasswordHasher {

    /** Lowest and highest log-rounds bcrypt accepts. */
    public static final int MIN_WORK_FACTOR = 4;
    public static final int MAX_WORK_FACTOR = 31;

    /** bcrypt only reads the first 72 bytes; anything longer is rejected outright. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Pattern DIGEST_PATTERN =
            Pattern.compile("\\A\\$2([aby])\\$(\\d\\d)\\$[./0-9A-Za-z]{53}\\z");

    private final int workFactor;
    private final SecureRandom random;

    public PasswordHasher(int workFactor) {
        this(workFactor, new SecureRandom());
    }

    public PasswordHasher(int workFactor, SecureRandom random) {
        if (workFactor < MIN_WORK_FACTOR || workFactor > MAX_WORK_FACTOR) {
            throw new ConfigurationException(
                    "work factor must be between %d and %d, was %d"
                            .formatted(MIN_WORK_FACTOR, MAX_WORK_FACTOR, workFactor));
        }
        if (random == null) {
            throw new ConfigurationException("random source must not be null");
        }
        this.workFactor = workFactor;
        this.random = random;
    }

    public int workFactor() {
        return workFactor;
    }

    /**
     * Hashes a plaintext password with a per-call random salt.
     *
     * @param plaintext the password
     * @return an opaque bcrypt digest ({@code $2b$<cost>$<salt+hash>})
     * @throws InvalidInputException if the plaintext is null, empty or longer than
     *     {@value #MAX_PASSWORD_BYTES} UTF-8 bytes
     */
    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new InvalidInputException("password must not be empty");
        }
        if (exceedsMaxLength(plaintext)) {
            throw new InvalidInputException(
                    "password must be at most %d bytes".formatted(MAX_PASSWORD_BYTES));
        }
        return BCrypt.hashpw(plaintext, BCrypt.gensalt("$2b", workFactor, random));
    }

    /**
     * Verifies a plaintext against a stored digest.
     * <p>
     * The comparison does not return early on the first differing byte. A mismatch, an empty
     * plaintext or an oversized plaintext all return {@code false}.
     *
     * @throws CorruptDigestException if the digest is not a well-formed bcrypt string
     */
    public boolean verify(String plaintext, String digest) {
        requireWellFormed(digest);
        if (plaintext == null || plaintext.isEmpty() || exceedsMaxLength(plaintext)) {
            return false;
        }
        return BCrypt.checkpw(plaintext, digest);
    }

    /**
     * Returns true when the digest was produced with a lower work factor than this hasher uses.
     *
     * @throws CorruptDigestException if the digest is not a well-formed bcrypt string
     */
    public boolean needsRehash(String digest) {
        return requireWellFormed(digest) < workFactor;
    }

    /** Returns the digest's cost, or throws if the digest is malformed. */
    private static int requireWellFormed(String digest) {
        if (digest == null) {
            throw new CorruptDigestException("password digest is missing");
        }
        Matcher matcher = DIGEST_PATTERN.matcher(digest);
        if (!matcher.matches()) {
            throw new CorruptDigestException("password digest is not a bcrypt digest");
        }
        int cost = Integer.parseInt(matcher.group(2));
        if (cost < MIN_WORK_FACTOR || cost > MAX_WORK_FACTOR) {
            throw new CorruptDigestException("password digest has an invalid cost: " + cost);
        }
        return cost;
    }

    private static boolean exceedsMaxLength(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
