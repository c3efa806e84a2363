package com.acme.crm.persistence.jdbc.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.dispatch.OutboundJobQueue;
import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.JobStatus;
import com.acme.crm.domain.OutboundPayload;
import com.acme.crm.persistence.jdbc.H2RepositoryTestBase;
import com.acme.crm.persistence.jdbc.conversation.JdbcConversationRepository;
import com.acme.crm.runner.JobRunResult;
import com.acme.crm.runner.OutboundJobRunner;
import com.acme.crm.runner.RetryPolicy;
import com.acme.crm.spi.MessagingProvider;
import com.acme.crm.spi.ProviderReceipt;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Two runners draining one table must deliver every job exactly once. */
class ConcurrentOutboundJobRunnerTest extends H2RepositoryTestBase {

  private static final int JOBS = 10;

  private H2OutboundJobRepository jobs;
  private ConversationStateStore conversations;
  private final Clock clock = Clock.systemUTC();

  @BeforeEach
  void setUp() throws Exception {
    clean("outbound_job", "conversation");
    jobs = new H2OutboundJobRepository(dataSource);
    JdbcConversationRepository conversationRepository = new JdbcConversationRepository(dataSource);
    conversations = new ConversationStateStore(conversationRepository, 5);

    OutboundJobQueue queue = new OutboundJobQueue(jobs, new DedupeKeyGenerator(), 3, clock);
    for (int i = 0; i < JOBS; i++) {
      Conversation c =
          conversationRepository.create(
              Conversation.open("contact-" + i, "whatsapp", "+97150000000" + i, clock.instant()));
      queue.enqueue(
          "job-" + i,
          new OutboundPayload("whatsapp", c.recipient(), "Reminder " + i, null, "test"),
          c.id());
    }
  }

  private OutboundJobRunner runner(String runnerId, MessagingProvider provider) {
    AutomationConfig config = new AutomationConfig();
    config.setRunnerId(runnerId);
    return new OutboundJobRunner(
        jobs,
        provider,
        conversations,
        new RetryPolicy(Duration.ofMillis(10), Duration.ofSeconds(1)),
        config,
        clock);
  }

  @Test
  @DisplayName("concurrent runners never send a job twice")
  void eachJobSentOnce() throws Exception {
    ConcurrentHashMap<String, AtomicInteger> deliveries = new ConcurrentHashMap<>();
    MessagingProvider provider =
        (target, text) -> {
          deliveries.computeIfAbsent(text, k -> new AtomicInteger()).incrementAndGet();
          return new ProviderReceipt("wamid." + target.conversationId());
        };

    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<JobRunResult>> results = new ArrayList<>();
    for (String id : List.of("runner-a", "runner-b")) {
      OutboundJobRunner runner = runner(id, provider);
      results.add(pool.submit(() -> {
        start.await();
        return runner.processOutboundJobs(JOBS);
      }));
    }
    start.countDown();

    int processed = 0;
    for (Future<JobRunResult> f : results) {
      processed += f.get(30, TimeUnit.SECONDS).processed();
    }
    pool.shutdown();

    assertThat(processed).isEqualTo(JOBS);
    assertThat(deliveries).hasSize(JOBS);
    assertThat(deliveries.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
    for (int i = 0; i < JOBS; i++) {
      assertThat(jobs.findByDedupeKey("job-" + i).orElseThrow().getStatus())
          .isEqualTo(JobStatus.SENT);
    }
  }

  @Test
  @DisplayName("a sent job stamps the conversation's last outbound time")
  void stampsConversation() {
    Instant before = clock.instant();

    runner("runner-a", (target, text) -> new ProviderReceipt("wamid.x")).processOutboundJobs(1);

    long conversationId = jobs.findByDedupeKey("job-0").orElseThrow().getConversationId();
    assertThat(conversations.get(conversationId).lastOutboundAt()).isAfterOrEqualTo(before);
  }
}
