package com.acme.crm.qualification;

import com.acme.crm.domain.Conversation;
import com.acme.crm.sanitize.ReplySanitizer;
import com.acme.crm.sanitize.SanitizedReply;
import com.acme.crm.spi.GenerationContext;
import com.acme.crm.spi.TextGenerator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the text for automated replies. Generated text is sanitized and checked against the
 * banned content policy; when generation fails or yields nothing safe, the reply template is used.
 * If qualification is still open, the next question is appended so follow-ups keep qualifying.
 */
public class ReplyComposer {

  private static final Logger LOG = LoggerFactory.getLogger(ReplyComposer.class);

  private final Optional<TextGenerator> generator;
  private final ReplySanitizer sanitizer;
  private final BannedContentPolicy policy;
  private final QuestionCatalog catalog;
  private final QualificationStateMachine stateMachine;

  public ReplyComposer(
      Optional<TextGenerator> generator,
      ReplySanitizer sanitizer,
      BannedContentPolicy policy,
      QuestionCatalog catalog,
      QualificationStateMachine stateMachine) {
    this.generator = generator;
    this.sanitizer = sanitizer;
    this.policy = policy;
    this.catalog = catalog;
    this.stateMachine = stateMachine;
  }

  public ComposedReply compose(
      Conversation conversation,
      String templateKey,
      String instruction,
      Map<String, String> variables) {
    Map<String, String> values = new HashMap<>(conversation.knownFields());
    values.putAll(variables);

    String pendingQuestion = pendingQuestion(conversation);

    if (generator.isPresent()) {
      String fullInstruction =
          pendingQuestion == null
              ? instruction
              : instruction + " Then ask: " + pendingQuestion;
      Optional<ComposedReply> generated =
          generate(conversation, templateKey, fullInstruction, values);
      if (generated.isPresent()) {
        return generated.get();
      }
    }

    if (!catalog.hasTemplate(templateKey)) {
      LOG.warn(
          "No usable reply for conversation {}: template {} unknown", conversation.id(), templateKey);
      return ComposedReply.none();
    }
    String text = catalog.renderTemplate(templateKey, values);
    if (pendingQuestion != null) {
      text = text + " " + pendingQuestion;
    }
    if (policy.containsBannedPhrase(text)) {
      LOG.warn(
          "Template {} rendered banned content for conversation {}",
          templateKey,
          conversation.id());
      return ComposedReply.none();
    }
    return new ComposedReply(text, ComposedReply.Source.TEMPLATE, false);
  }

  private Optional<ComposedReply> generate(
      Conversation conversation,
      String templateKey,
      String instruction,
      Map<String, String> values) {
    try {
      String raw =
          generator
              .get()
              .generate(
                  new GenerationContext(
                      conversation.id(), templateKey, instruction, values.get("name"), values));
      SanitizedReply reply = sanitizer.sanitize(raw);
      if (reply.wasJson()) {
        LOG.warn(
            "Generator returned JSON-shaped text for conversation {}, extracted plain text",
            conversation.id());
      }
      if (reply.isEmpty()) {
        LOG.warn("Generator returned empty text for conversation {}", conversation.id());
        return Optional.empty();
      }
      if (policy.containsBannedPhrase(reply.text())) {
        LOG.warn(
            "Generated reply for conversation {} contained banned content, using template",
            conversation.id());
        return Optional.empty();
      }
      return Optional.of(
          new ComposedReply(reply.text(), ComposedReply.Source.GENERATED, reply.wasJson()));
    } catch (RuntimeException e) {
      LOG.warn(
          "Text generation failed for conversation {}, using template: {}",
          conversation.id(),
          e.getMessage());
      return Optional.empty();
    }
  }

  private String pendingQuestion(Conversation conversation) {
    QualificationIntent intent = stateMachine.nextQualificationAction(conversation);
    if (intent instanceof QualificationIntent.AskQuestion ask) {
      return ask.text();
    }
    return null;
  }
}
