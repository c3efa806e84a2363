package com.acme.crm.runner;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

  private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(1), Duration.ofMinutes(5));

  @Test
  @DisplayName("backoff doubles per attempt starting at the base")
  void testDoubling() {
    assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofSeconds(4));
    assertThat(policy.backoffFor(9)).isEqualTo(Duration.ofSeconds(256));
  }

  @Test
  @DisplayName("backoff is capped at the maximum")
  void testCapped() {
    assertThat(policy.backoffFor(10)).isEqualTo(Duration.ofMinutes(5));
    assertThat(policy.backoffFor(1_000)).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  @DisplayName("attempt zero or below is treated as the first attempt")
  void testLowerBound() {
    assertThat(policy.backoffFor(0)).isEqualTo(Duration.ofSeconds(1));
  }
}
