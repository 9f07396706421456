package com.whisperecho.gate.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DecodeResultTest {

  @Test
  void success_exposesValue() {
    DecodeResult<String> result = DecodeResult.success("ok");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.asOptional()).contains("ok");
    assertThat(result.error()).isNull();
  }

  @Test
  void failure_exposesError() {
    DecodeResult<String> result = DecodeResult.failure(DecodeError.expired("too old"));

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.asOptional()).isEmpty();
    assertThat(result.error().kind()).isEqualTo(DecodeError.Kind.EXPIRED);
  }

  @Test
  void constructor_bothSet_throws() {
    assertThatThrownBy(() -> new DecodeResult<>("v", DecodeError.malformed("x")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
