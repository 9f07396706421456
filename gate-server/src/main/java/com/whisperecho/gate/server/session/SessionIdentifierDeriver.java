package com.whisperecho.gate.server.session;

import com.whisperecho.gate.server.model.SessionIdentifier;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Derives the session identifier that labels an anonymous request.
 * <p>
 * The identifier is SHA-256 over each string field as a 4-byte big-endian length followed by its
 * UTF-8 bytes, then the 8-byte big-endian timestamp. Length prefixes keep distinct inputs from
 * colliding through delimiter ambiguity ({@code "a:b" + "c"} versus {@code "a" + "b:c"}). Null
 * fields are treated as empty.
 * <p>
 * The result is a label for analytics and rate-limit bucketing. It grants nothing.
 */
public class SessionIdentifierDeriver {

  /**
   * Derives a session identifier.
   *
   * @param sourceAddress        remote address, may be null
   * @param agentString          {@code User-Agent} header, may be null
   * @param timestampEpochMillis request timestamp
   * @return the identifier as lowercase hex
   */
  public SessionIdentifier deriveSessionId(String sourceAddress, String agentString,
                                           long timestampEpochMillis) {
    SHA256Digest digest = new SHA256Digest();
    update(digest, sourceAddress);
    update(digest, agentString);
    byte[] timestamp = ByteBuffer.allocate(Long.BYTES).putLong(timestampEpochMillis).array();
    digest.update(timestamp, 0, timestamp.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return new SessionIdentifier(Hex.toHexString(out));
  }

  private static void update(SHA256Digest digest, String field) {
    byte[] bytes = field == null ? new byte[0] : field.getBytes(StandardCharsets.UTF_8);
    byte[] length = ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array();
    digest.update(length, 0, length.length);
    digest.update(bytes, 0, bytes.length);
  }
}
