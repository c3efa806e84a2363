package com.acme.crm.engine;

import com.acme.crm.conversation.ConversationStateStore;
import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.dedupe.TimeBucket;
import com.acme.crm.dispatch.DispatchRequest;
import com.acme.crm.dispatch.DispatchResult;
import com.acme.crm.dispatch.OutboundDispatcher;
import com.acme.crm.domain.Conversation;
import com.acme.crm.domain.DispatchOrigin;
import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.OutboundPayload;
import com.acme.crm.domain.QualificationStage;
import com.acme.crm.domain.TaskAssignee;
import com.acme.crm.domain.TaskRequest;
import com.acme.crm.qualification.ComposedReply;
import com.acme.crm.qualification.QuestionCatalog;
import com.acme.crm.qualification.ReplyComposer;
import com.acme.crm.rule.ActionType;
import com.acme.crm.rule.RuleAction;
import com.acme.crm.rule.TriggerCondition;
import com.acme.crm.spi.LeadGateway;
import com.acme.crm.spi.TaskStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs one rule action against its collaborator. In a dry run every step runs except the final
 * write, and the outcome carries exactly what would have been written.
 */
public class ActionExecutor {

  static final String AGENT_TASK_TYPE = "ESCALATION";

  private final ReplyComposer replyComposer;
  private final OutboundDispatcher dispatcher;
  private final ConversationStateStore conversations;
  private final DedupeKeyGenerator dedupeKeys;
  private final TaskStore taskStore;
  private final LeadGateway leads;
  private final FollowupCadence cadence;

  public ActionExecutor(
      ReplyComposer replyComposer,
      OutboundDispatcher dispatcher,
      ConversationStateStore conversations,
      DedupeKeyGenerator dedupeKeys,
      TaskStore taskStore,
      LeadGateway leads) {
    this.replyComposer = replyComposer;
    this.dispatcher = dispatcher;
    this.conversations = conversations;
    this.dedupeKeys = dedupeKeys;
    this.taskStore = taskStore;
    this.leads = leads;
    this.cadence = new FollowupCadence(dedupeKeys);
  }

  public ActionOutcome execute(RuleAction action, ActionContext ctx) {
    if (action instanceof RuleAction.SendAiReply a) {
      return sendReply(a, ctx);
    }
    if (action instanceof RuleAction.CreateTask a) {
      return createTask(a, ctx);
    }
    if (action instanceof RuleAction.SetNextFollowup a) {
      return setNextFollowup(a, ctx);
    }
    if (action instanceof RuleAction.CreateAgentTask a) {
      return createAgentTask(a, ctx);
    }
    if (action instanceof RuleAction.SetPriority a) {
      return setPriority(a, ctx);
    }
    if (action instanceof RuleAction.ScheduleFollowupCadence a) {
      return scheduleCadence(a, ctx);
    }
    throw new IllegalStateException("Unhandled action " + action);
  }

  private ActionOutcome sendReply(RuleAction.SendAiReply action, ActionContext ctx) {
    LeadSnapshot lead = ctx.lead();
    if (!lead.hasConversation()) {
      return ActionOutcome.skipped(ActionType.SEND_AI_REPLY, "lead has no conversation");
    }
    Conversation conversation = conversations.get(lead.conversationId());
    if (conversation.stage().isTerminal() || conversation.archived()) {
      return ActionOutcome.skipped(
          ActionType.SEND_AI_REPLY, "conversation is " + conversation.stage());
    }

    ComposedReply reply =
        replyComposer.compose(
            conversation, action.templateKey(), action.instruction(), ctx.variables());
    if (reply.isEmpty()) {
      return ActionOutcome.skipped(ActionType.SEND_AI_REPLY, "no safe reply text");
    }

    String dedupeKey =
        dedupeKeys.key(
            conversation.id(),
            "rule:" + ctx.rule().ruleKey() + ":" + ctx.checkpointKey(),
            TimeBucket.DAY,
            ctx.now());
    OutboundPayload payload =
        new OutboundPayload(
            conversation.channel(),
            conversation.recipient(),
            reply.text(),
            action.templateKey(),
            "rule:" + ctx.rule().ruleKey());
    DispatchResult result =
        dispatcher.dispatch(
            new DispatchRequest(conversation.id(), DispatchOrigin.AUTOMATION, dedupeKey, payload),
            ctx.isDryRun());

    switch (result.outcome()) {
      case ENQUEUED:
        ctx.recordReply(ctx.now(), result.jobId());
        return new ActionOutcome(
            ActionType.SEND_AI_REPLY,
            ActionStatus.EXECUTED,
            "queued job " + result.jobId(),
            dedupeKey,
            result.jobId(),
            reply.text(),
            ctx.now());
      case WOULD_ENQUEUE:
        ctx.recordReply(ctx.now(), null);
        return new ActionOutcome(
            ActionType.SEND_AI_REPLY,
            ActionStatus.PLANNED,
            "would queue reply (" + reply.source() + ")",
            dedupeKey,
            null,
            reply.text(),
            ctx.now());
      case DUPLICATE:
        return new ActionOutcome(
            ActionType.SEND_AI_REPLY,
            ActionStatus.SKIPPED,
            "already queued as job " + result.jobId(),
            dedupeKey,
            result.jobId(),
            null,
            null);
      case RATE_LIMITED:
        return new ActionOutcome(
            ActionType.SEND_AI_REPLY,
            ActionStatus.DEFERRED,
            "conversation in cool-down",
            dedupeKey,
            null,
            reply.text(),
            null);
      default:
        throw new IllegalStateException("Unhandled dispatch outcome " + result.outcome());
    }
  }

  private ActionOutcome createTask(RuleAction.CreateTask action, ActionContext ctx) {
    LeadSnapshot lead = ctx.lead();
    Instant dueAt = ctx.now().plus(Duration.ofDays(action.dueInDays()));
    String title = QuestionCatalog.render(action.title(), ctx.variables());
    TaskRequest request =
        new TaskRequest(
            taskKey(ctx),
            lead.leadId(),
            lead.conversationId(),
            title,
            action.taskType(),
            TaskAssignee.OWNER,
            lead.priority() != null ? lead.priority() : LeadPriority.NORMAL,
            dueAt);
    return writeTask(ActionType.CREATE_TASK, request, ctx);
  }

  private ActionOutcome createAgentTask(RuleAction.CreateAgentTask action, ActionContext ctx) {
    LeadSnapshot lead = ctx.lead();
    TaskRequest request =
        new TaskRequest(
            taskKey(ctx),
            lead.leadId(),
            lead.conversationId(),
            "Escalation: " + QuestionCatalog.render(action.reason(), ctx.variables()),
            AGENT_TASK_TYPE,
            TaskAssignee.AGENT,
            action.priority() != null ? action.priority() : LeadPriority.HIGH,
            ctx.now());
    return writeTask(ActionType.CREATE_AGENT_TASK, request, ctx);
  }

  private ActionOutcome scheduleCadence(
      RuleAction.ScheduleFollowupCadence action, ActionContext ctx) {
    LeadSnapshot lead = ctx.lead();
    if (lead.stage() == QualificationStage.CLOSED) {
      return ActionOutcome.skipped(ActionType.SCHEDULE_FOLLOWUP_CADENCE, "lead is closed");
    }
    List<TaskRequest> plan =
        cadence.plan(
            lead, action.cadenceDays(), action.titlePrefix(), action.taskType(), cadenceAnchor(ctx));
    TaskRequest first = plan.get(0);
    String detail = plan.size() + " follow-up tasks from " + first.title();
    if (ctx.isDryRun()) {
      return new ActionOutcome(
          ActionType.SCHEDULE_FOLLOWUP_CADENCE,
          ActionStatus.PLANNED,
          "would schedule " + detail,
          first.taskKey(),
          null,
          first.title(),
          first.dueAt());
    }
    Long firstId = null;
    for (TaskRequest request : plan) {
      long taskId = taskStore.createTask(request);
      if (firstId == null) {
        firstId = taskId;
      }
    }
    return new ActionOutcome(
        ActionType.SCHEDULE_FOLLOWUP_CADENCE,
        ActionStatus.EXECUTED,
        "scheduled " + detail,
        first.taskKey(),
        firstId,
        first.title(),
        first.dueAt());
  }

  // Stage rules count from the stage change so a late pass still schedules the same tasks.
  private static Instant cadenceAnchor(ActionContext ctx) {
    Instant stageChangedAt = ctx.lead().stageChangedAt();
    if (ctx.rule().condition() instanceof TriggerCondition.StageReached
        && stageChangedAt != null) {
      return stageChangedAt;
    }
    return ctx.now();
  }

  private ActionOutcome writeTask(ActionType type, TaskRequest request, ActionContext ctx) {
    if (ctx.isDryRun()) {
      return new ActionOutcome(
          type,
          ActionStatus.PLANNED,
          "would create task '" + request.title() + "'",
          request.taskKey(),
          null,
          request.title(),
          request.dueAt());
    }
    long taskId = taskStore.createTask(request);
    return new ActionOutcome(
        type,
        ActionStatus.EXECUTED,
        "task " + taskId,
        request.taskKey(),
        taskId,
        request.title(),
        request.dueAt());
  }

  private ActionOutcome setNextFollowup(RuleAction.SetNextFollowup action, ActionContext ctx) {
    if (action.requireSend() && !ctx.replySent()) {
      return ActionOutcome.skipped(ActionType.SET_NEXT_FOLLOWUP, "no reply was sent");
    }
    Instant base = ctx.replySent() ? ctx.replySentAt() : ctx.now();
    Instant nextFollowUp = base.plus(Duration.ofDays(action.daysFromNow()));
    if (ctx.isDryRun()) {
      return new ActionOutcome(
          ActionType.SET_NEXT_FOLLOWUP,
          ActionStatus.PLANNED,
          "would set next follow-up",
          null,
          null,
          null,
          nextFollowUp);
    }
    leads.updateNextFollowUp(ctx.lead().leadId(), nextFollowUp);
    return new ActionOutcome(
        ActionType.SET_NEXT_FOLLOWUP,
        ActionStatus.EXECUTED,
        "next follow-up set",
        null,
        null,
        null,
        nextFollowUp);
  }

  private ActionOutcome setPriority(RuleAction.SetPriority action, ActionContext ctx) {
    if (action.priority() == ctx.lead().priority()) {
      return ActionOutcome.skipped(ActionType.SET_PRIORITY, "priority already " + action.priority());
    }
    if (ctx.isDryRun()) {
      return new ActionOutcome(
          ActionType.SET_PRIORITY,
          ActionStatus.PLANNED,
          "would set priority " + action.priority(),
          null,
          null,
          null,
          null);
    }
    leads.updatePriority(ctx.lead().leadId(), action.priority());
    return new ActionOutcome(
        ActionType.SET_PRIORITY,
        ActionStatus.EXECUTED,
        "priority " + action.priority(),
        null,
        null,
        null,
        null);
  }

  private String taskKey(ActionContext ctx) {
    return dedupeKeys.taskKey(
        ctx.lead().leadId(),
        "rule:" + ctx.rule().ruleKey() + ":" + ctx.checkpointKey() + ":" + ctx.actionIndex(),
        ctx.now());
  }
}
