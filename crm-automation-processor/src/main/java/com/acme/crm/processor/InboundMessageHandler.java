package com.acme.crm.processor;

import com.acme.crm.engine.AutomationRuleEngine;
import com.acme.crm.engine.InboundEvent;
import com.acme.crm.engine.RuleRunSummary;
import com.acme.crm.qualification.InboundMessage;
import com.acme.crm.qualification.QualificationOutcome;
import com.acme.crm.qualification.ReplyOrchestrator;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for a customer message that has already been matched to a conversation and run
 * through field extraction. The qualification reply goes first and event rules run after it. A
 * reply to an inbound message does not take the automation cool-down, so an event rule can still
 * send on the same message; only earlier automated sends hold it back.
 */
@Slf4j
@Singleton
public class InboundMessageHandler {

  private final ReplyOrchestrator orchestrator;
  private final AutomationRuleEngine engine;

  public InboundMessageHandler(ReplyOrchestrator orchestrator, AutomationRuleEngine engine) {
    this.orchestrator = orchestrator;
    this.engine = engine;
  }

  public QualificationOutcome handle(InboundMessage message) {
    QualificationOutcome outcome = orchestrator.handleInbound(message);
    log.debug(
        "Conversation {} intent={} replied={}",
        message.conversationId(),
        outcome.intent().getClass().getSimpleName(),
        outcome.replied());

    try {
      RuleRunSummary summary =
          engine.runEventRules(
              new InboundEvent(
                  message.conversationId(),
                  message.providerMessageId(),
                  message.text(),
                  message.receivedAt()));
      if (summary.rulesMatched() > 0) {
        log.info(
            "Event rules for {}: matched={} sent={}",
            message.providerMessageId(),
            summary.rulesMatched(),
            summary.sent());
      }
    } catch (Exception e) {
      log.error(
          "Event rules failed for message {}: {}", message.providerMessageId(), e.getMessage(), e);
    }
    return outcome;
  }
}
