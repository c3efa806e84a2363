package com.acme.crm.processor.config;

import com.acme.crm.config.AutomationConfig;
import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.dispatch.OutboundDispatcher;
import com.acme.crm.dispatch.OutboundJobQueue;
import com.acme.crm.dispatch.RateLimiter;
import com.acme.crm.engine.ActionExecutor;
import com.acme.crm.engine.AutomationRuleEngine;
import com.acme.crm.engine.ConditionEvaluator;
import com.acme.crm.qualification.BannedContentPolicy;
import com.acme.crm.qualification.QualificationStateMachine;
import com.acme.crm.qualification.QuestionCatalog;
import com.acme.crm.qualification.ReplyComposer;
import com.acme.crm.qualification.ReplyOrchestrator;
import com.acme.crm.repository.AutomationRuleRepository;
import com.acme.crm.repository.AutomationRunLogRepository;
import com.acme.crm.repository.ConversationRepository;
import com.acme.crm.repository.OutboundJobRepository;
import com.acme.crm.rule.AutomationRuleService;
import com.acme.crm.rule.RuleValidator;
import com.acme.crm.runner.OutboundJobRunner;
import com.acme.crm.runner.RetryPolicy;
import com.acme.crm.sanitize.ReplySanitizer;
import com.acme.crm.spi.LeadGateway;
import com.acme.crm.spi.MessagingProvider;
import com.acme.crm.spi.TaskStore;
import com.acme.crm.spi.TextGenerator;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Optional;

/**
 * Factory for the core automation beans.
 *
 * <p>The core module is plain Java with constructor injection. This factory is the only place that
 * knows how the pieces fit together and which {@code automation.*} settings each one takes.
 */
@Factory
public class CoreBeansFactory {

  /** Creates AutomationConfig populated from application.yml automation.* properties */
  @Singleton
  @ConfigurationProperties("automation")
  public AutomationConfig automationConfig() {
    return new AutomationConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Singleton
  public DedupeKeyGenerator dedupeKeyGenerator() {
    return new DedupeKeyGenerator();
  }

  @Singleton
  public ReplySanitizer replySanitizer() {
    return new ReplySanitizer();
  }

  @Singleton
  public QuestionCatalog questionCatalog() {
    return QuestionCatalog.standard();
  }

  @Singleton
  public BannedContentPolicy bannedContentPolicy() {
    return BannedContentPolicy.defaults();
  }

  @Singleton
  public QualificationStateMachine qualificationStateMachine(
      QuestionCatalog catalog, BannedContentPolicy policy, AutomationConfig config) {
    return new QualificationStateMachine(catalog, policy, config.getMaxQuestions());
  }

  @Singleton
  public ConversationStateStore conversationStateStore(
      ConversationRepository repository, AutomationConfig config) {
    return new ConversationStateStore(repository, config.getCasMaxAttempts());
  }

  @Singleton
  public RateLimiter rateLimiter(
      ConversationStateStore conversations, AutomationConfig config, Clock clock) {
    return new RateLimiter(conversations, config.getCooldown(), clock);
  }

  @Singleton
  public OutboundJobQueue outboundJobQueue(
      OutboundJobRepository repository,
      DedupeKeyGenerator dedupeKeys,
      AutomationConfig config,
      Clock clock) {
    return new OutboundJobQueue(repository, dedupeKeys, config.getMaxAttempts(), clock);
  }

  @Singleton
  public OutboundDispatcher outboundDispatcher(OutboundJobQueue queue, RateLimiter rateLimiter) {
    return new OutboundDispatcher(queue, rateLimiter);
  }

  /** The generator is optional; without one, replies fall back to catalog templates. */
  @Singleton
  public ReplyComposer replyComposer(
      Optional<TextGenerator> generator,
      ReplySanitizer sanitizer,
      BannedContentPolicy policy,
      QuestionCatalog catalog,
      QualificationStateMachine stateMachine) {
    return new ReplyComposer(generator, sanitizer, policy, catalog, stateMachine);
  }

  @Singleton
  public ReplyOrchestrator replyOrchestrator(
      ConversationStateStore conversations,
      QualificationStateMachine stateMachine,
      OutboundDispatcher dispatcher,
      OutboundJobQueue queue,
      DedupeKeyGenerator dedupeKeys,
      Clock clock) {
    return new ReplyOrchestrator(conversations, stateMachine, dispatcher, queue, dedupeKeys, clock);
  }

  @Singleton
  public RetryPolicy retryPolicy(AutomationConfig config) {
    return new RetryPolicy(config.getBackoffBase(), config.getMaxBackoff());
  }

  @Singleton
  public OutboundJobRunner outboundJobRunner(
      OutboundJobRepository repository,
      MessagingProvider provider,
      ConversationStateStore conversations,
      RetryPolicy retryPolicy,
      AutomationConfig config,
      Clock clock) {
    return new OutboundJobRunner(repository, provider, conversations, retryPolicy, config, clock);
  }

  @Singleton
  public RuleValidator ruleValidator() {
    return new RuleValidator();
  }

  @Singleton
  public AutomationRuleService automationRuleService(
      AutomationRuleRepository repository, RuleValidator validator) {
    return new AutomationRuleService(repository, validator);
  }

  @Singleton
  public ConditionEvaluator conditionEvaluator(AutomationConfig config) {
    return new ConditionEvaluator(config.getReminderWindowDays());
  }

  @Singleton
  public ActionExecutor actionExecutor(
      ReplyComposer replyComposer,
      OutboundDispatcher dispatcher,
      ConversationStateStore conversations,
      DedupeKeyGenerator dedupeKeys,
      TaskStore taskStore,
      LeadGateway leads) {
    return new ActionExecutor(replyComposer, dispatcher, conversations, dedupeKeys, taskStore, leads);
  }

  @Singleton
  public AutomationRuleEngine automationRuleEngine(
      AutomationRuleRepository rules,
      AutomationRunLogRepository runLogs,
      LeadGateway leads,
      ConditionEvaluator evaluator,
      ActionExecutor executor,
      RateLimiter rateLimiter,
      AutomationConfig config,
      Clock clock) {
    return new AutomationRuleEngine(
        rules, runLogs, leads, evaluator, executor, rateLimiter, config.getCandidateLimit(), clock);
  }
}
