package com.whisperecho.gate.codec;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding a credential: exactly one of a value or a {@link DecodeError}.
 *
 * @param value the decoded value, null on failure
 * @param error the failure, null on success
 * @param <T>   decoded type
 */
public record DecodeResult<T>(T value, DecodeError error) {

  public DecodeResult {
    if ((value == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of value or error must be set");
    }
  }

  /**
   * Successful decode.
   *
   * @param value the decoded value
   * @param <T>   decoded type
   * @return the result
   */
  public static <T> DecodeResult<T> success(T value) {
    return new DecodeResult<>(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Failed decode.
   *
   * @param error the failure
   * @param <T>   decoded type
   * @return the result
   */
  public static <T> DecodeResult<T> failure(DecodeError error) {
    return new DecodeResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return value != null;
  }

  public Optional<T> asOptional() {
    return Optional.ofNullable(value);
  }
}
