package mailflow.ledger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic job keys: lower-case hex SHA-256 of {@code campaignId + ":" + normalised address}.
 * Registering the same recipient twice always yields the same key.
 */
public final class JobKeys {

  private JobKeys() {
  }

  public static String of(String campaignId, String email) {
    String material = campaignId + ":" + normalizeEmail(email);
    return HexFormat.of().formatHex(sha256().digest(material.getBytes(StandardCharsets.UTF_8)));
  }

  /** Trimmed and lower-cased. */
  public static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
