package com.acme.crm.qualification;

import com.acme.crm.domain.QualificationStage;
import java.util.Optional;

/** The single next step the state machine decided on. Every variant carries its stage-after. */
public sealed interface QualificationIntent {

  QualificationStage stageAfter();

  /** Text to send to the customer, if this intent produces one. */
  default Optional<String> replyText() {
    return Optional.empty();
  }

  /** Ask for the highest-priority missing field. */
  record AskQuestion(
      String questionKey, String field, String text, QualificationStage stageAfter)
      implements QualificationIntent {
    @Override
    public Optional<String> replyText() {
      return Optional.of(text);
    }
  }

  /** All fields of the current stage are known; move exactly one stage forward. */
  record AdvanceStage(
      String templateKey,
      String text,
      QualificationStage stageBefore,
      QualificationStage stageAfter)
      implements QualificationIntent {
    @Override
    public Optional<String> replyText() {
      return Optional.ofNullable(text);
    }
  }

  /** The candidate question was banned; a safe generic prompt goes out instead. */
  record FallbackPrompt(String text, String suppressed, QualificationStage stageAfter)
      implements QualificationIntent {
    @Override
    public Optional<String> replyText() {
      return Optional.of(text);
    }
  }

  /** Stop automating and hand the conversation to a human. */
  record HandOff(HandOffReason reason, String text, QualificationStage stageAfter)
      implements QualificationIntent {
    @Override
    public Optional<String> replyText() {
      return Optional.ofNullable(text);
    }
  }

  /** Nothing to do. Callers treat this as success. */
  record NoAction(String reason, QualificationStage stageAfter) implements QualificationIntent {}
}
