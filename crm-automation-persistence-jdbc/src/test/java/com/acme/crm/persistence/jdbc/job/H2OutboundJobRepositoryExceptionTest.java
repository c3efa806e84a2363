package com.acme.crm.persistence.jdbc.job;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.crm.core.PermanentException;
import com.acme.crm.domain.JobStatus;
import com.acme.crm.domain.OutboundJob;
import com.acme.crm.persistence.jdbc.H2RepositoryFaultyTestBase;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** A missing table surfaces as a non-retryable error from every operation. */
class H2OutboundJobRepositoryExceptionTest extends H2RepositoryFaultyTestBase {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private H2OutboundJobRepository repository;

  @BeforeEach
  void setUp() {
    repository = new H2OutboundJobRepository(dataSource);
  }

  @Test
  @DisplayName("insertIfAbsent translates the SQLException")
  void insert() {
    OutboundJob job =
        OutboundJob.builder()
            .dedupeKey("k")
            .conversationId(1L)
            .channel("whatsapp")
            .recipient("+1")
            .body("hi")
            .status(JobStatus.QUEUED)
            .maxAttempts(3)
            .nextAttemptAt(NOW)
            .createdAt(NOW)
            .updatedAt(NOW)
            .build();

    assertThatThrownBy(() -> repository.insertIfAbsent(job))
        .isInstanceOf(PermanentException.class)
        .hasMessageContaining("insert outbound job");
  }

  @Test
  @DisplayName("claim translates the SQLException")
  void claim() {
    assertThatThrownBy(() -> repository.claim(1L, "runner", NOW))
        .isInstanceOf(PermanentException.class);
  }

  @Test
  @DisplayName("findDueQueuedIds translates the SQLException")
  void findDue() {
    assertThatThrownBy(() -> repository.findDueQueuedIds(10, NOW))
        .isInstanceOf(PermanentException.class);
  }

  @Test
  @DisplayName("failStaleClaims translates the SQLException")
  void failStale() {
    assertThatThrownBy(() -> repository.failStaleClaims(NOW, "expired", NOW))
        .isInstanceOf(PermanentException.class);
  }
}
