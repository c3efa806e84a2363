package com.acme.crm.qualification;

import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.QualificationStage;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the next qualification step for a conversation: ask the highest-priority missing field,
 * acknowledge and advance one stage, fall back to a safe prompt, hand off, or do nothing.
 *
 * <p>Pure: it never writes. The caller persists the resulting conversation change and dispatches
 * the reply.
 */
public class QualificationStateMachine {

  private static final Logger LOG = LoggerFactory.getLogger(QualificationStateMachine.class);

  public static final List<String> DEFAULT_HANDOFF_PHRASES =
      List.of(
          "speak to someone",
          "talk to someone",
          "speak to a person",
          "real person",
          "human",
          "call me",
          "agent");

  private final QuestionCatalog catalog;
  private final BannedContentPolicy policy;
  private final int maxQuestions;
  private final List<String> handoffPhrases;

  public QualificationStateMachine(
      QuestionCatalog catalog,
      BannedContentPolicy policy,
      int maxQuestions,
      List<String> handoffPhrases) {
    this.catalog = catalog;
    this.policy = policy;
    this.maxQuestions = maxQuestions;
    this.handoffPhrases = handoffPhrases.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
  }

  public QualificationStateMachine(
      QuestionCatalog catalog, BannedContentPolicy policy, int maxQuestions) {
    this(catalog, policy, maxQuestions, DEFAULT_HANDOFF_PHRASES);
  }

  public QualificationIntent nextQualificationAction(Conversation snapshot) {
    return nextQualificationAction(snapshot, Map.of(), null);
  }

  /**
   * @param snapshot conversation as last read
   * @param extractedFields fields extracted from the latest inbound message, merged before deciding
   * @param inboundText latest inbound text, may be null for scheduled evaluation
   */
  public QualificationIntent nextQualificationAction(
      Conversation snapshot, Map<String, String> extractedFields, String inboundText) {
    Conversation conversation = snapshot.mergeFields(extractedFields);
    QualificationStage stage = conversation.stage();

    if (stage.isTerminal()) {
      return new QualificationIntent.NoAction("stage " + stage + " is terminal", stage);
    }
    if (requestsHuman(inboundText)) {
      return handOff(HandOffReason.CUSTOMER_REQUESTED, conversation);
    }
    if (!catalog.isFieldGated(stage)) {
      return new QualificationIntent.NoAction("stage " + stage + " advances on events", stage);
    }

    Map<String, String> known = conversation.knownFields();
    List<QuestionDefinition> missing =
        catalog.requiredFor(stage, known).stream()
            .filter(q -> !conversation.hasField(q.field()))
            .toList();

    if (missing.isEmpty()) {
      return advance(conversation);
    }
    if (conversation.questionsAsked() >= maxQuestions) {
      return handOff(HandOffReason.QUESTION_LIMIT, conversation);
    }

    String suppressed = null;
    boolean repeated = false;
    for (QuestionDefinition question : missing) {
      if (policy.isBannedKey(question.questionKey())) {
        LOG.warn(
            "Suppressed banned question key {} for conversation {}",
            question.questionKey(),
            conversation.id());
        suppressed = question.questionKey();
        continue;
      }
      if (question.questionKey().equals(conversation.lastQuestionKey())) {
        repeated = true;
        continue;
      }
      String text = QuestionCatalog.render(question.prompt(), known);
      Optional<String> banned = policy.findBannedPhrase(text);
      if (banned.isPresent()) {
        LOG.warn(
            "Suppressed question {} containing banned phrase '{}' for conversation {}",
            question.questionKey(),
            banned.get(),
            conversation.id());
        suppressed = question.questionKey();
        continue;
      }
      return new QualificationIntent.AskQuestion(
          question.questionKey(), question.field(), text, stage);
    }

    if (suppressed != null) {
      return fallback(suppressed, conversation);
    }
    if (repeated) {
      return handOff(HandOffReason.UNANSWERED, conversation);
    }
    return new QualificationIntent.NoAction("no applicable question", stage);
  }

  private QualificationIntent advance(Conversation conversation) {
    QualificationStage before = conversation.stage();
    QualificationStage after = before.next();
    String templateKey = "advance_" + before.name().toLowerCase(Locale.ROOT);
    String text = null;
    if (catalog.hasTemplate(templateKey)) {
      text = safeText(catalog.renderTemplate(templateKey, conversation.knownFields()));
      if (text == null) {
        text = safeText(catalog.renderTemplate(QuestionCatalog.GENERIC_PROMPT, Map.of()));
      }
    }
    return new QualificationIntent.AdvanceStage(templateKey, text, before, after);
  }

  private QualificationIntent fallback(String suppressed, Conversation conversation) {
    String text =
        safeText(
            catalog.renderTemplate(QuestionCatalog.GENERIC_PROMPT, conversation.knownFields()));
    if (text == null) {
      return handOff(HandOffReason.NO_SAFE_PROMPT, conversation);
    }
    return new QualificationIntent.FallbackPrompt(text, suppressed, conversation.stage());
  }

  private QualificationIntent handOff(HandOffReason reason, Conversation conversation) {
    String text =
        safeText(catalog.renderTemplate(QuestionCatalog.HANDOFF, conversation.knownFields()));
    return new QualificationIntent.HandOff(reason, text, QualificationStage.HANDED_OFF);
  }

  private String safeText(String text) {
    if (text == null || text.isBlank() || policy.containsBannedPhrase(text)) {
      return null;
    }
    return text;
  }

  private boolean requestsHuman(String inboundText) {
    if (inboundText == null || inboundText.isBlank()) {
      return false;
    }
    String lower = inboundText.toLowerCase(Locale.ROOT);
    return handoffPhrases.stream().anyMatch(lower::contains);
  }
}
