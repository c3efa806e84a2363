package com.acme.crm.dispatch;

import static org.assertj.core.api.Assertions.*;

import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.domain.Conversation;
import com.acme.crm.support.InMemoryConversationRepository;
import com.acme.crm.support.MutableClock;
import com.acme.crm.support.TestData;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimiter Tests")
class RateLimiterTest {

  private static final Duration COOLDOWN = Duration.ofMinutes(10);

  private MutableClock clock;
  private ConversationStateStore store;
  private RateLimiter limiter;
  private long conversationId;

  @BeforeEach
  void setUp() {
    InMemoryConversationRepository repository = new InMemoryConversationRepository();
    clock = new MutableClock(TestData.NOW);
    store = new ConversationStateStore(repository, 5);
    limiter = new RateLimiter(store, COOLDOWN, clock);
    conversationId = repository.create(TestData.intake(Map.of())).id();
  }

  @Test
  @DisplayName("the first automated send is allowed and stamps the conversation")
  void testFirstSend() {
    assertThat(limiter.tryAcquire(conversationId)).isTrue();

    assertThat(store.get(conversationId).lastAutomatedSendAt()).isEqualTo(TestData.NOW);
  }

  @Test
  @DisplayName("a second send inside the cool-down is suppressed")
  void testInsideCooldown() {
    limiter.tryAcquire(conversationId);
    clock.advance(Duration.ofMinutes(9));

    assertThat(limiter.tryAcquire(conversationId)).isFalse();
    assertThat(store.get(conversationId).lastAutomatedSendAt()).isEqualTo(TestData.NOW);
  }

  @Test
  @DisplayName("the slot opens again exactly when the cool-down elapses")
  void testCooldownElapsed() {
    limiter.tryAcquire(conversationId);
    clock.advance(COOLDOWN);

    assertThat(limiter.tryAcquire(conversationId)).isTrue();
  }

  @Test
  @DisplayName("releasing a slot restores the previous stamp")
  void testRelease() {
    limiter.tryAcquire(conversationId);
    clock.advance(COOLDOWN);
    RateLimiter.Slot slot = limiter.acquire(conversationId).orElseThrow();

    limiter.release(slot);

    assertThat(slot.previous()).isEqualTo(TestData.NOW);
    assertThat(store.get(conversationId).lastAutomatedSendAt()).isEqualTo(TestData.NOW);
  }

  @Test
  @DisplayName("releasing a slot leaves a newer stamp alone")
  void testReleaseAfterNewerStamp() {
    RateLimiter.Slot slot = limiter.acquire(conversationId).orElseThrow();
    Conversation current = store.get(conversationId);
    store.mutate(
        conversationId, c -> c.withLastAutomatedSendAt(TestData.NOW.plus(Duration.ofMinutes(30))));

    limiter.release(slot);

    assertThat(current.lastAutomatedSendAt()).isEqualTo(TestData.NOW);
    assertThat(store.get(conversationId).lastAutomatedSendAt())
        .isEqualTo(TestData.NOW.plus(Duration.ofMinutes(30)));
  }

  @Test
  @DisplayName("check never writes")
  void testCheckIsReadOnly() {
    assertThat(limiter.check(conversationId)).isTrue();

    Conversation after = store.get(conversationId);
    assertThat(after.stateVersion()).isZero();
    assertThat(after.lastAutomatedSendAt()).isNull();
  }

  @Test
  @DisplayName("nextAllowedAt is the last send plus the cool-down")
  void testNextAllowedAt() {
    limiter.tryAcquire(conversationId);

    assertThat(limiter.nextAllowedAt(store.get(conversationId)))
        .isEqualTo(TestData.NOW.plus(COOLDOWN));
  }

  @Test
  @DisplayName("concurrent acquirers on one conversation get exactly one slot")
  void testConcurrentAcquire() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return limiter.tryAcquire(conversationId);
                }));
      }
      start.countDown();

      int acquired = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) {
          acquired++;
        }
      }
      assertThat(acquired).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }
}
