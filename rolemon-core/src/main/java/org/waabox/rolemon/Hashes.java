package org.waabox.rolemon;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Set;
import java.util.TreeSet;

/**
 * SHA-256 helpers shared by the loop and the store implementations.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Hashes {

  /** Separates role names in the role hash input. */
  private static final byte ROLE_DELIMITER = '\n';

  private Hashes() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Hashes the given bytes.
   *
   * @param bytes the content, never null
   *
   * @return the lowercase hex SHA-256 digest, never null
   */
  public static String sha256(final byte[] bytes) {
    final MessageDigest digest = newDigest();
    digest.update(bytes);
    return toHexString(digest.digest());
  }

  /**
   * Hashes a role set independently of its iteration order.
   *
   * @param roles the role names, never null
   *
   * @return the lowercase hex SHA-256 digest, never null
   */
  public static String ofRoles(final Set<String> roles) {
    final MessageDigest digest = newDigest();
    for (final String role : new TreeSet<>(roles)) {
      digest.update(role.getBytes(StandardCharsets.UTF_8));
      digest.update(ROLE_DELIMITER);
    }
    return toHexString(digest.digest());
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  private static String toHexString(final byte[] bytes) {
    final char[] hexChars = new char[bytes.length * 2];
    final char[] alphabet = "0123456789abcdef".toCharArray();
    for (int i = 0; i < bytes.length; i++) {
      final int v = bytes[i] & 0xFF;
      hexChars[i * 2] = alphabet[v >>> 4];
      hexChars[i * 2 + 1] = alphabet[v & 0x0F];
    }
    return new String(hexChars);
  }
}
