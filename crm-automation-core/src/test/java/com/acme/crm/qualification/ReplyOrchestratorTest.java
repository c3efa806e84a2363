package com.acme.crm.qualification;

import static org.assertj.core.api.Assertions.*;

import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.dispatch.DispatchOutcome;
import com.acme.crm.dispatch.OutboundDispatcher;
import com.acme.crm.dispatch.OutboundJobQueue;
import com.acme.crm.dispatch.RateLimiter;
import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.OutboundJob;
import com.acme.crm.domain.QualificationStage;
import com.acme.crm.support.InMemoryConversationRepository;
import com.acme.crm.support.InMemoryOutboundJobRepository;
import com.acme.crm.support.MutableClock;
import com.acme.crm.support.TestData;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReplyOrchestrator Tests")
class ReplyOrchestratorTest {

  private InMemoryConversationRepository conversations;
  private InMemoryOutboundJobRepository jobs;
  private ConversationStateStore store;
  private ReplyOrchestrator orchestrator;
  private long conversationId;

  @BeforeEach
  void setUp() {
    wire(new InMemoryConversationRepository());
    conversationId = conversations.create(TestData.intake(Map.of())).id();
  }

  private void wire(InMemoryConversationRepository repository) {
    MutableClock clock = new MutableClock(TestData.NOW);
    conversations = repository;
    jobs = new InMemoryOutboundJobRepository();
    store = new ConversationStateStore(conversations, 3);
    DedupeKeyGenerator keys = new DedupeKeyGenerator();
    OutboundJobQueue queue = new OutboundJobQueue(jobs, keys, 3, clock);
    OutboundDispatcher dispatcher =
        new OutboundDispatcher(queue, new RateLimiter(store, Duration.ofMinutes(60), clock));
    QualificationStateMachine machine =
        new QualificationStateMachine(
            QuestionCatalog.standard(), BannedContentPolicy.defaults(), 5);
    orchestrator = new ReplyOrchestrator(store, machine, dispatcher, queue, keys, clock);
  }

  private InboundMessage inbound(String id, String text, Map<String, String> fields) {
    return new InboundMessage(conversationId, id, text, fields, TestData.NOW.minusSeconds(5));
  }

  @Test
  @DisplayName("a first message asks for the name and records the question")
  void testAsksName() {
    QualificationOutcome outcome = orchestrator.handleInbound(inbound("wamid.1", "Hi", Map.of()));

    assertThat(outcome.intent()).isInstanceOf(QualificationIntent.AskQuestion.class);
    assertThat(outcome.replied()).isTrue();
    Conversation committed = store.get(conversationId);
    assertThat(committed.lastQuestionKey()).isEqualTo("ask_name");
    assertThat(committed.questionsAsked()).isEqualTo(1);
    assertThat(committed.stateVersion()).isEqualTo(1L);
    assertThat(committed.lastInboundAt()).isEqualTo(TestData.NOW.minusSeconds(5));
    assertThat(committed.lastAutomatedSendAt()).isNull();

    OutboundJob job = jobs.all().get(0);
    assertThat(job.getBody()).isEqualTo("May I have your name, please?");
    assertThat(job.getTemplateRef()).isEqualTo("ask_name");
    assertThat(job.getIntent()).isEqualTo(ReplyOrchestrator.QUALIFICATION_INTENT);
  }

  @Test
  @DisplayName("extracted fields are persisted and the next missing field is asked")
  void testMergesFields() {
    orchestrator.handleInbound(
        inbound("wamid.1", "I'm Sara, I need a visa", Map.of("name", "Sara", "service", "visa")));

    Conversation committed = store.get(conversationId);
    assertThat(committed.knownFields()).containsEntry("name", "Sara").containsEntry("service", "visa");
    assertThat(committed.stage()).isEqualTo(QualificationStage.INTAKE);
    assertThat(jobs.all().get(0).getBody()).isEqualTo("Thanks Sara. What is your nationality?");
  }

  @Test
  @DisplayName("answering the last INTAKE field advances to QUALIFYING")
  void testAdvances() {
    orchestrator.handleInbound(
        inbound("wamid.1", "details", Map.of("name", "Sara", "service", "visa", "nationality", "Indian")));

    Conversation committed = store.get(conversationId);
    assertThat(committed.stage()).isEqualTo(QualificationStage.QUALIFYING);
    assertThat(committed.stageChangedAt()).isEqualTo(TestData.NOW);
  }

  @Test
  @DisplayName("a redelivered inbound message is not answered twice")
  void testRedelivery() {
    orchestrator.handleInbound(inbound("wamid.1", "Hi", Map.of()));

    QualificationOutcome again = orchestrator.handleInbound(inbound("wamid.1", "Hi", Map.of()));

    assertThat(again.intent()).isInstanceOf(QualificationIntent.NoAction.class);
    assertThat(again.dispatch()).isNull();
    assertThat(jobs.all()).hasSize(1);
    assertThat(store.get(conversationId).questionsAsked()).isEqualTo(1);
  }

  @Test
  @DisplayName("a message redelivered while the first delivery is in flight is handled once")
  void testConcurrentRedelivery() throws Exception {
    CyclicBarrier bothRead = new CyclicBarrier(2);
    AtomicInteger reads = new AtomicInteger();
    InMemoryConversationRepository racing =
        new InMemoryConversationRepository() {
          @Override
          public Optional<Conversation> findById(long id) {
            Optional<Conversation> row = super.findById(id);
            if (reads.incrementAndGet() <= 2) {
              // both deliveries decide on the same version before either commits
              try {
                bothRead.await(5, TimeUnit.SECONDS);
              } catch (Exception e) {
                throw new IllegalStateException(e);
              }
            }
            return row;
          }
        };
    long id = racing.create(TestData.intake(Map.of())).id();
    wire(racing);
    InboundMessage message =
        new InboundMessage(id, "wamid.7", "Hi", Map.of(), TestData.NOW.minusSeconds(5));

    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<QualificationOutcome> first = pool.submit(() -> orchestrator.handleInbound(message));
      Future<QualificationOutcome> second = pool.submit(() -> orchestrator.handleInbound(message));
      List<QualificationOutcome> outcomes =
          List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));

      assertThat(outcomes).filteredOn(QualificationOutcome::replied).hasSize(1);
      assertThat(outcomes)
          .filteredOn(o -> o.intent() instanceof QualificationIntent.NoAction)
          .hasSize(1);
    } finally {
      pool.shutdownNow();
    }

    Conversation committed = store.get(id);
    assertThat(committed.questionsAsked()).isEqualTo(1);
    assertThat(committed.lastQuestionKey()).isEqualTo("ask_name");
    assertThat(committed.lastInboundMessageId()).isEqualTo("wamid.7");
    assertThat(jobs.all()).singleElement()
        .satisfies(j -> assertThat(j.getBody()).isEqualTo("May I have your name, please?"));
  }

  @Test
  @DisplayName("a redelivered message that needed no reply does not change the state again")
  void testRedeliveryWithoutReply() {
    conversations.put(store.get(conversationId).advanceTo(QualificationStage.CLOSED, TestData.NOW));
    orchestrator.handleInbound(inbound("wamid.3", "thanks", Map.of()));
    long version = store.get(conversationId).stateVersion();

    QualificationOutcome again = orchestrator.handleInbound(inbound("wamid.3", "thanks", Map.of()));

    assertThat(again.intent()).isInstanceOfSatisfying(
        QualificationIntent.NoAction.class,
        n -> assertThat(n.reason()).isEqualTo("inbound already handled"));
    assertThat(store.get(conversationId).stateVersion()).isEqualTo(version);
  }

  @Test
  @DisplayName("asking for a person hands the conversation off")
  void testHandOff() {
    QualificationOutcome outcome =
        orchestrator.handleInbound(inbound("wamid.1", "Can I talk to someone please", Map.of()));

    assertThat(outcome.intent()).isInstanceOf(QualificationIntent.HandOff.class);
    assertThat(store.get(conversationId).stage()).isEqualTo(QualificationStage.HANDED_OFF);
    assertThat(jobs.all().get(0).getTemplateRef()).isEqualTo(QuestionCatalog.HANDOFF);
  }

  @Test
  @DisplayName("replies are not held back by the automation cool-down")
  void testNotRateLimited() {
    conversations.put(store.get(conversationId).withLastAutomatedSendAt(TestData.NOW));

    QualificationOutcome outcome = orchestrator.handleInbound(inbound("wamid.1", "Hi", Map.of()));

    assertThat(outcome.dispatch().outcome()).isEqualTo(DispatchOutcome.ENQUEUED);
  }

  @Test
  @DisplayName("a concurrent write is retried and the decision re-taken")
  void testConcurrentWrite() {
    conversations.failNextWrites(1);

    QualificationOutcome outcome = orchestrator.handleInbound(inbound("wamid.1", "Hi", Map.of()));

    assertThat(outcome.conversation().stateVersion()).isEqualTo(1L);
    assertThat(outcome.conversation().questionsAsked()).isEqualTo(1);
  }

  @Test
  @DisplayName("a terminal conversation gets no reply")
  void testTerminal() {
    conversations.put(store.get(conversationId).advanceTo(QualificationStage.CLOSED, TestData.NOW));

    QualificationOutcome outcome = orchestrator.handleInbound(inbound("wamid.9", "hello?", Map.of()));

    assertThat(outcome.intent()).isInstanceOf(QualificationIntent.NoAction.class);
    assertThat(outcome.replied()).isFalse();
    assertThat(jobs.all()).isEmpty();
  }
}
