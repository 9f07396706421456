package com.whisperecho.gate.codec;

/**
 * Typed failure from decoding attacker-controlled credential text.
 *
 * @param kind   what went wrong
 * @param detail short diagnostic, safe to log (never contains the credential)
 */
public record DecodeError(Kind kind, String detail) {

  /**
   * Decode failure kinds.
   */
  public enum Kind {
    /** Structurally invalid input: bad alphabet, wrong delimiter count, missing fields. */
    MALFORMED,
    /** Well-formed but the signature does not verify. */
    SIGNATURE_INVALID,
    /** Well-formed and signed but past its expiry. */
    EXPIRED
  }

  public static DecodeError malformed(String detail) {
    return new DecodeError(Kind.MALFORMED, detail);
  }

  public static DecodeError signatureInvalid(String detail) {
    return new DecodeError(Kind.SIGNATURE_INVALID, detail);
  }

  public static DecodeError expired(String detail) {
    return new DecodeError(Kind.EXPIRED, detail);
  }
}
