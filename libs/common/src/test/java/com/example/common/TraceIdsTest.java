package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newRequestIdIsCompactHex() {
    final String requestId = TraceIds.newRequestId();

    assertThat(requestId).hasSize(32).matches("[0-9a-f]+");
    assertThat(TraceIds.isAcceptableRequestId(requestId)).isTrue();
  }

  @Test
  void rejectsRequestIdWithControlCharacters() {
    assertThat(TraceIds.isAcceptableRequestId("req-1\nforged=true")).isFalse();
    assertThat(TraceIds.isAcceptableRequestId(" ")).isFalse();
    assertThat(TraceIds.isAcceptableRequestId(null)).isFalse();
  }

  @Test
  void rejectsOverlongRequestId() {
    assertThat(TraceIds.isAcceptableRequestId("a".repeat(129))).isFalse();
    assertThat(TraceIds.isAcceptableRequestId("a".repeat(128))).isTrue();
  }
}
