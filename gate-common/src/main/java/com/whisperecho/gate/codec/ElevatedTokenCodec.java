package com.whisperecho.gate.codec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Reversible wire encoding of the elevated-access triple {@code username:secret:issuedAtEpochMillis}.
 * <p>
 * The encoding is standard Base64 over UTF-8 text. It is an obfuscation for transport, not a
 * signature: anyone who reads a token can replay it. {@link #decode(String)} never throws on
 * input and reports every problem as a {@link DecodeError}.
 */
public final class ElevatedTokenCodec {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();
  private static final String DELIMITER = ":";
  private static final int FIELD_COUNT = 3;

  private ElevatedTokenCodec() {
  }

  /**
   * Encodes an elevated-access triple.
   *
   * @param username            administrator username, must not contain {@code :}
   * @param secret              administrator secret, must not contain {@code :}
   * @param issuedAtEpochMillis minting time
   * @return the wire token
   * @throws IllegalArgumentException if a field is empty or contains the delimiter
   */
  public static String encode(String username, String secret, long issuedAtEpochMillis) {
    requireField(username, "username");
    requireField(secret, "secret");
    String plain = username + DELIMITER + secret + DELIMITER + issuedAtEpochMillis;
    return B64.encodeToString(plain.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decodes a wire token.
   *
   * @param token the token as received, may be null
   * @return the decoded credential, or a {@link DecodeError.Kind#MALFORMED} failure
   */
  public static DecodeResult<ElevatedCredential> decode(String token) {
    if (token == null || token.isBlank()) {
      return DecodeResult.failure(DecodeError.malformed("empty elevated token"));
    }
    byte[] raw;
    try {
      raw = B64D.decode(token.trim());
    } catch (IllegalArgumentException e) {
      return DecodeResult.failure(DecodeError.malformed("invalid base64"));
    }
    String plain;
    try {
      plain = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(raw))
          .toString();
    } catch (CharacterCodingException e) {
      return DecodeResult.failure(DecodeError.malformed("invalid UTF-8"));
    }
    String[] fields = plain.split(DELIMITER, -1);
    if (fields.length != FIELD_COUNT) {
      return DecodeResult.failure(
          DecodeError.malformed("expected " + FIELD_COUNT + " fields, got " + fields.length));
    }
    if (fields[0].isEmpty() || fields[1].isEmpty()) {
      return DecodeResult.failure(DecodeError.malformed("empty username or secret"));
    }
    long issuedAt;
    try {
      issuedAt = Long.parseLong(fields[2]);
    } catch (NumberFormatException e) {
      return DecodeResult.failure(DecodeError.malformed("non-numeric timestamp"));
    }
    return DecodeResult.success(new ElevatedCredential(fields[0], fields[1], issuedAt));
  }

  private static void requireField(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
    if (value.contains(DELIMITER)) {
      throw new IllegalArgumentException("Field may not contain '" + DELIMITER + "': " + name);
    }
  }
}
