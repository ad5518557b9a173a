package com.codeheadsystems.tessera.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Generates refresh secrets and computes the one-way hash stored on the session.
 * <p>
 * The secret is 32 random bytes (base64url); the stored form is its hex SHA-256. A fast hash is
 * enough because the input is full-entropy, and it keeps the hash deterministic so the session
 * store can compare-and-swap on it.
 */
public class RefreshSecrets {

  private static final int SECRET_BYTES = 32;
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final SecureRandom random;

  public RefreshSecrets(SecureRandom random) {
    this.random = random;
  }

  /**
   * Generates a fresh refresh secret.
   *
   * @return base64url encoded secret
   */
  public String generate() {
    byte[] bytes = new byte[SECRET_BYTES];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }

  /**
   * Hex SHA-256 of the secret.
   *
   * @param secret the plaintext secret
   * @return the hash
   */
  public String hash(String secret) {
    byte[] input = secret.getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  /**
   * Constant-time check that the secret hashes to the stored hash.
   *
   * @param secret     plaintext secret carried by a refresh token, may be null
   * @param storedHash hash stored on the session
   * @return true on match
   */
  public boolean matches(String secret, String storedHash) {
    if (secret == null || storedHash == null) {
      return false;
    }
    byte[] computed = hash(secret).getBytes(StandardCharsets.US_ASCII);
    byte[] stored = storedHash.getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(computed, stored);
  }
}
