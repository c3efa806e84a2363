package com.acme.crm.qualification;

import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.dispatch.DispatchRequest;
import com.acme.crm.dispatch.DispatchResult;
import com.acme.crm.dispatch.OutboundDispatcher;
import com.acme.crm.dispatch.OutboundJobQueue;
import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.DispatchOrigin;
import com.acme.crm.domain.OutboundPayload;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles a qualified inbound message: merges extracted fields, asks the state machine for the
 * next step, commits the conversation change through the state version and queues the reply.
 */
public class ReplyOrchestrator {

  private static final Logger LOG = LoggerFactory.getLogger(ReplyOrchestrator.class);

  static final String QUALIFICATION_INTENT = "qualification";

  private final ConversationStateStore conversations;
  private final QualificationStateMachine stateMachine;
  private final OutboundDispatcher dispatcher;
  private final OutboundJobQueue queue;
  private final DedupeKeyGenerator dedupeKeys;
  private final Clock clock;

  public ReplyOrchestrator(
      ConversationStateStore conversations,
      QualificationStateMachine stateMachine,
      OutboundDispatcher dispatcher,
      OutboundJobQueue queue,
      DedupeKeyGenerator dedupeKeys,
      Clock clock) {
    this.conversations = conversations;
    this.stateMachine = stateMachine;
    this.dispatcher = dispatcher;
    this.queue = queue;
    this.dedupeKeys = dedupeKeys;
    this.clock = clock;
  }

  public QualificationOutcome handleInbound(InboundMessage message) {
    long conversationId = message.conversationId();
    String dedupeKey = dedupeKeys.inboundReplyKey(conversationId, message.providerMessageId());

    if (queue.findByDedupeKey(dedupeKey).isPresent()) {
      return alreadyHandled(message, "inbound already answered");
    }

    Instant now = clock.instant();
    AtomicReference<QualificationIntent> decided = new AtomicReference<>();
    Optional<Conversation> committedState =
        conversations.mutateIf(
            conversationId,
            current -> {
              // a concurrent delivery of the same message committed first
              if (current.hasHandled(message.providerMessageId())) {
                return Optional.empty();
              }
              // re-decided on every attempt against the freshly read state
              Conversation merged =
                  current
                      .mergeFields(message.extractedFields())
                      .withLastInboundAt(message.receivedAt())
                      .withLastInboundMessageId(message.providerMessageId())
                      .withUpdatedAt(now);
              QualificationIntent intent =
                  stateMachine.nextQualificationAction(merged, Map.of(), message.text());
              decided.set(intent);
              return Optional.of(apply(merged, intent, now));
            });
    if (committedState.isEmpty()) {
      return alreadyHandled(message, "inbound already handled");
    }
    Conversation committed = committedState.get();

    QualificationIntent intent = decided.get();
    LOG.debug(
        "Conversation {} intent {} stage {}",
        conversationId,
        intent.getClass().getSimpleName(),
        committed.stage());

    Optional<String> text = intent.replyText();
    if (text.isEmpty()) {
      return new QualificationOutcome(intent, committed, null);
    }
    OutboundPayload payload =
        new OutboundPayload(
            committed.channel(),
            committed.recipient(),
            text.get(),
            templateRef(intent),
            QUALIFICATION_INTENT);
    DispatchResult dispatch =
        dispatcher.dispatch(
            new DispatchRequest(conversationId, DispatchOrigin.INBOUND_REPLY, dedupeKey, payload));
    return new QualificationOutcome(intent, committed, dispatch);
  }

  private QualificationOutcome alreadyHandled(InboundMessage message, String reason) {
    LOG.info(
        "Inbound {} on conversation {} skipped: {}",
        message.providerMessageId(),
        message.conversationId(),
        reason);
    Conversation current = conversations.get(message.conversationId());
    return new QualificationOutcome(
        new QualificationIntent.NoAction(reason, current.stage()), current, null);
  }

  static Conversation apply(Conversation conversation, QualificationIntent intent, Instant now) {
    if (intent instanceof QualificationIntent.AskQuestion ask) {
      return conversation.recordQuestion(ask.questionKey());
    }
    if (intent instanceof QualificationIntent.AdvanceStage advance) {
      return conversation.advanceTo(advance.stageAfter(), now);
    }
    if (intent instanceof QualificationIntent.FallbackPrompt) {
      return conversation.recordQuestion(QuestionCatalog.GENERIC_PROMPT);
    }
    if (intent instanceof QualificationIntent.HandOff handOff) {
      return conversation.advanceTo(handOff.stageAfter(), now);
    }
    return conversation;
  }

  private static String templateRef(QualificationIntent intent) {
    if (intent instanceof QualificationIntent.AskQuestion ask) {
      return ask.questionKey();
    }
    if (intent instanceof QualificationIntent.AdvanceStage advance) {
      return advance.templateKey();
    }
    if (intent instanceof QualificationIntent.FallbackPrompt) {
      return QuestionCatalog.GENERIC_PROMPT;
    }
    return QuestionCatalog.HANDOFF;
  }
}
