package com.ariia.security.password;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PBKDF2-HMAC-SHA256 password hashing.
 * <p>
 * Stored format: {@code pbkdf2_sha256$<rounds>$<b64url salt>$<b64url key>}, base64 without
 * padding. Hashes with fewer than {@link #MIN_ROUNDS} rounds are never produced and never
 * accepted.
 */
public final class PasswordHasher {

    public static final String SCHEME = "pbkdf2_sha256";
    public static final int MIN_ROUNDS = 200_000;

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecureRandom random;
    private final int rounds;
    private volatile String dummyHash;

    public PasswordHasher() {
        this(MIN_ROUNDS);
    }

    public PasswordHasher(int rounds) {
        this(rounds, new SecureRandom());
    }

    PasswordHasher(int rounds, SecureRandom random) {
        if (rounds < MIN_ROUNDS) {
            throw new IllegalArgumentException("rounds must be at least " + MIN_ROUNDS + ", got " + rounds);
        }
        this.rounds = rounds;
        this.random = random;
    }

    /**
     * Hashes {@code password} with a fresh random salt.
     */
    public String hash(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        byte[] key = derive(password, salt, rounds, KEY_BITS);
        return String.join("$", SCHEME, Integer.toString(rounds), ENCODER.encodeToString(salt),
                ENCODER.encodeToString(key));
    }

    /**
     * Checks {@code password} against a stored hash. Never throws: an unparseable, unknown-scheme
     * or under-strength hash simply does not verify.
     */
    public boolean verify(String password, String storedHash) {
        if (password == null || storedHash == null) {
            return false;
        }
        String[] parts = storedHash.split("\\$", -1);
        if (parts.length != 4 || !SCHEME.equals(parts[0])) {
            return false;
        }
        int storedRounds;
        byte[] salt;
        byte[] expected;
        try {
            storedRounds = Integer.parseInt(parts[1]);
            salt = DECODER.decode(parts[2]);
            expected = DECODER.decode(parts[3]);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (storedRounds < MIN_ROUNDS || salt.length == 0 || expected.length == 0) {
            return false;
        }
        byte[] actual = derive(password, salt, storedRounds, expected.length * 8);
        return MessageDigest.isEqual(actual, expected);
    }

    /**
     * A throwaway hash, used to spend the same work on unknown accounts as on known ones.
     * Computed once per hasher.
     */
    public String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = hash(ENCODER.encodeToString(randomBytes()));
            dummyHash = hash;
        }
        return hash;
    }

    private byte[] randomBytes() {
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        return bytes;
    }

    private static byte[] derive(String password, byte[] salt, int rounds, int keyBits) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, rounds, keyBits);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }
}
