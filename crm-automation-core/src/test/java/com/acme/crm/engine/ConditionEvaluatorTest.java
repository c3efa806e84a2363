package com.acme.crm.engine;

import static org.assertj.core.api.Assertions.*;

import com.acme.crm.domain.ExpiryItem;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.QualificationStage;
import com.acme.crm.domain.ReminderRecord;
import com.acme.crm.rule.AutomationRule;
import com.acme.crm.rule.RuleAction;
import com.acme.crm.rule.TriggerCondition;
import com.acme.crm.support.TestData;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConditionEvaluator Tests")
class ConditionEvaluatorTest {

  private static final Instant NOW = TestData.NOW;
  private static final LocalDate TODAY = LocalDate.parse("2026-03-10");

  private final ConditionEvaluator evaluator = new ConditionEvaluator(1);

  private static AutomationRule rule(String key, String schedule, TriggerCondition condition) {
    return AutomationRule.define(
        key, key, schedule, condition, List.of(new RuleAction.SendAiReply("reengagement", null)));
  }

  private static LeadSnapshot lead() {
    return TestData.lead(7L, 70L);
  }

  private static ReminderRecord reminded(String ruleKey, String checkpoint, Instant at) {
    return new ReminderRecord(ruleKey, checkpoint, at);
  }

  @Nested
  @DisplayName("EXPIRY_WINDOW")
  class Expiry {

    private final AutomationRule rule =
        rule("expiry_30", AutomationRule.DAILY, new TriggerCondition.ExpiryWindow(30, null, null));

    @Test
    @DisplayName("an item exactly at the window edge matches with its variables")
    void testAtEdge() {
      LeadSnapshot lead =
          TestData.withExpiry(lead(), new ExpiryItem(11L, "VISA", TODAY.plusDays(30)));

      ConditionMatch match = evaluator.evaluate(rule, lead, NOW, null);

      assertThat(match.matched()).isTrue();
      assertThat(match.checkpointKey()).isEqualTo("expiry:11");
      assertThat(match.variables())
          .containsEntry("itemType", "visa")
          .containsEntry("expiryDate", "2026-04-09")
          .containsEntry("daysUntil", "30")
          .containsEntry("name", "Sara");
    }

    @Test
    @DisplayName("items further out, already expired or undated do not match")
    void testOutsideWindow() {
      LeadSnapshot lead =
          TestData.withExpiry(
              lead(),
              new ExpiryItem(1L, "visa", TODAY.plusDays(31)),
              new ExpiryItem(2L, "visa", TODAY.minusDays(1)),
              new ExpiryItem(3L, "visa", null));

      ConditionMatch match = evaluator.evaluate(rule, lead, NOW, null);

      assertThat(match.matched()).isFalse();
      assertThat(match.reason()).contains("no item within 30 days");
    }

    @Test
    @DisplayName("a reminder already sent this window suppresses the match")
    void testAlreadyReminded() {
      LeadSnapshot lead =
          TestData.withExpiry(lead(), new ExpiryItem(11L, "visa", TODAY.plusDays(30)))
              .withReminderHistory(List.of(reminded("expiry_30", "expiry:11", NOW.minusSeconds(3600))));

      ConditionMatch match = evaluator.evaluate(rule, lead, NOW, null);

      assertThat(match.matched()).isFalse();
      assertThat(match.reason()).isEqualTo("already reminded this window");
    }

    @Test
    @DisplayName("the next due item is offered when the nearest one was already reminded")
    void testNextItem() {
      LeadSnapshot lead =
          TestData.withExpiry(
                  lead(),
                  new ExpiryItem(11L, "visa", TODAY.plusDays(10)),
                  new ExpiryItem(12L, "emirates_id", TODAY.plusDays(20)))
              .withReminderHistory(List.of(reminded("expiry_30", "expiry:11", NOW)));

      ConditionMatch match = evaluator.evaluate(rule, lead, NOW, null);

      assertThat(match.checkpointKey()).isEqualTo("expiry:12");
      assertThat(match.variables()).containsEntry("itemType", "emirates id");
    }

    @Test
    @DisplayName("reminders of another rule do not count")
    void testOtherRuleHistory() {
      LeadSnapshot lead =
          TestData.withExpiry(lead(), new ExpiryItem(11L, "visa", TODAY.plusDays(30)))
              .withReminderHistory(List.of(reminded("expiry_7", "expiry:11", NOW)));

      assertThat(evaluator.evaluate(rule, lead, NOW, null).matched()).isTrue();
    }

    @Test
    @DisplayName("a tolerance narrows the window to a band around the checkpoint")
    void testToleranceBand() {
      AutomationRule banded =
          rule("expiry_7", AutomationRule.DAILY, new TriggerCondition.ExpiryWindow(7, null, 2));

      ConditionMatch early =
          evaluator.evaluate(
              banded, TestData.withExpiry(lead(), new ExpiryItem(1L, "visa", TODAY.plusDays(9))), NOW, null);
      ConditionMatch late =
          evaluator.evaluate(
              banded, TestData.withExpiry(lead(), new ExpiryItem(2L, "visa", TODAY.plusDays(4))), NOW, null);

      assertThat(early.matched()).isTrue();
      assertThat(late.matched()).isFalse();
      assertThat(late.reason()).contains("no item within 5 to 9 days");
    }

    @Test
    @DisplayName("a reminder on the first day of the band still counts on its last day")
    void testReminderEarlyInBand() {
      AutomationRule banded =
          rule("expiry_7", AutomationRule.DAILY, new TriggerCondition.ExpiryWindow(7, null, 2));
      LeadSnapshot lead =
          TestData.withExpiry(lead(), new ExpiryItem(11L, "visa", TODAY.plusDays(5)))
              .withReminderHistory(
                  List.of(reminded("expiry_7", "expiry:11", NOW.minus(Duration.ofDays(4)))));

      ConditionMatch match = evaluator.evaluate(banded, lead, NOW, null);

      assertThat(match.matched()).isFalse();
      assertThat(match.reason()).isEqualTo("already reminded this window");
    }

    @Test
    @DisplayName("the expiry type filter is case-insensitive")
    void testTypeFilter() {
      AutomationRule visaOnly =
          rule("visa_expiry", AutomationRule.DAILY, new TriggerCondition.ExpiryWindow(30, "Visa", null));
      LeadSnapshot licence =
          TestData.withExpiry(lead(), new ExpiryItem(1L, "trade_licence", TODAY.plusDays(5)));
      LeadSnapshot visa = TestData.withExpiry(lead(), new ExpiryItem(2L, "VISA", TODAY.plusDays(5)));

      assertThat(evaluator.evaluate(visaOnly, licence, NOW, null).matched()).isFalse();
      assertThat(evaluator.evaluate(visaOnly, visa, NOW, null).matched()).isTrue();
    }
  }

  @Nested
  @DisplayName("INFO_SHARED")
  class InfoShared {

    private final AutomationRule rule =
        rule("info_3d", AutomationRule.DAILY, new TriggerCondition.InfoShared(3, null));

    @Test
    @DisplayName("matches on the day the delay elapses and one window day after")
    void testWindow() {
      Instant shared = NOW.minus(Duration.ofDays(3));

      assertThat(evaluator.evaluate(rule, TestData.withInfoShared(lead(), shared, "brochure"), NOW, null).checkpointKey())
          .isEqualTo("info:2026-03-07");
      assertThat(
              evaluator
                  .evaluate(rule, TestData.withInfoShared(lead(), shared.minus(Duration.ofDays(1)), "brochure"), NOW, null)
                  .matched())
          .isTrue();
    }

    @Test
    @DisplayName("too early, too late or nothing shared does not match")
    void testNoMatch() {
      assertThat(evaluator.evaluate(rule, lead(), NOW, null).matched()).isFalse();
      assertThat(
              evaluator
                  .evaluate(rule, TestData.withInfoShared(lead(), NOW.minus(Duration.ofDays(2)), "brochure"), NOW, null)
                  .matched())
          .isFalse();
      assertThat(
              evaluator
                  .evaluate(rule, TestData.withInfoShared(lead(), NOW.minus(Duration.ofDays(5)), "brochure"), NOW, null)
                  .matched())
          .isFalse();
    }

    @Test
    @DisplayName("the info type filter excludes other shares")
    void testTypeFilter() {
      AutomationRule quotes =
          rule("quote_3d", AutomationRule.DAILY, new TriggerCondition.InfoShared(3, "quote"));

      ConditionMatch match =
          evaluator.evaluate(
              quotes, TestData.withInfoShared(lead(), NOW.minus(Duration.ofDays(3)), "brochure"), NOW, null);

      assertThat(match.matched()).isFalse();
    }

    @Test
    @DisplayName("a handled checkpoint is not matched again")
    void testCheckpointHandled() {
      LeadSnapshot lead =
          TestData.withInfoShared(lead(), NOW.minus(Duration.ofDays(3)), "brochure")
              .withReminderHistory(List.of(reminded("info_3d", "info:2026-03-07", NOW)));

      ConditionMatch match = evaluator.evaluate(rule, lead, NOW, null);

      assertThat(match.matched()).isFalse();
      assertThat(match.reason()).contains("already handled");
    }
  }

  @Nested
  @DisplayName("inactivity triggers")
  class Inactivity {

    @Test
    @DisplayName("NO_REPLY_SLA matches an unanswered inbound older than the SLA")
    void testNoReplySla() {
      AutomationRule rule = rule("sla_24h", AutomationRule.HOURLY, new TriggerCondition.NoReplySla(24));
      LeadSnapshot unanswered =
          TestData.withActivity(lead(), NOW.minus(Duration.ofHours(25)), NOW.minus(Duration.ofDays(2)), null);
      LeadSnapshot answered =
          TestData.withActivity(lead(), NOW.minus(Duration.ofHours(25)), NOW.minus(Duration.ofHours(24)), null);
      LeadSnapshot recent = TestData.withActivity(lead(), NOW.minus(Duration.ofHours(23)), null, null);

      ConditionMatch match = evaluator.evaluate(rule, unanswered, NOW, null);
      assertThat(match.matched()).isTrue();
      assertThat(match.variables()).containsEntry("hoursWithoutReply", "25");

      assertThat(evaluator.evaluate(rule, answered, NOW, null).reason()).isEqualTo("already replied");
      assertThat(evaluator.evaluate(rule, recent, NOW, null).matched()).isFalse();
    }

    @Test
    @DisplayName("FOLLOWUP_OVERDUE matches once the follow-up is past due by the grace hours")
    void testFollowupOverdue() {
      AutomationRule rule =
          rule("followup_due", AutomationRule.HOURLY, new TriggerCondition.FollowupOverdue(2));
      LeadSnapshot overdue =
          TestData.withActivity(lead(), null, null, NOW.minus(Duration.ofHours(3)));
      LeadSnapshot notYet = TestData.withActivity(lead(), null, null, NOW.minus(Duration.ofHours(1)));

      assertThat(evaluator.evaluate(rule, overdue, NOW, null).matched()).isTrue();
      assertThat(evaluator.evaluate(rule, notYet, NOW, null).matched()).isFalse();
      assertThat(evaluator.evaluate(rule, lead(), NOW, null).reason()).isEqualTo("no follow-up scheduled");
    }

    @Test
    @DisplayName("NO_ACTIVITY falls back to the lead creation time")
    void testNoActivity() {
      AutomationRule rule =
          rule("idle_7d", AutomationRule.DAILY, new TriggerCondition.NoActivity(7));
      LeadSnapshot active = TestData.withActivity(lead(), NOW.minus(Duration.ofDays(2)), null, null);

      ConditionMatch idle = evaluator.evaluate(rule, lead(), NOW, null);

      assertThat(idle.matched()).isTrue();
      assertThat(idle.variables()).containsEntry("idleDays", "30");
      assertThat(evaluator.evaluate(rule, active, NOW, null).matched()).isFalse();
    }
  }

  @Nested
  @DisplayName("STAGE_REACHED")
  class Stage {

    @Test
    @DisplayName("matches when the lead has been in the stage long enough")
    void testStageReached() {
      AutomationRule longEnough =
          rule("stuck_qualifying", AutomationRule.DAILY, new TriggerCondition.StageReached(QualificationStage.QUALIFYING, 7));
      AutomationRule tooSoon =
          rule("stuck_qualifying_2w", AutomationRule.DAILY, new TriggerCondition.StageReached(QualificationStage.QUALIFYING, 11));
      AutomationRule otherStage =
          rule("quoted", AutomationRule.DAILY, new TriggerCondition.StageReached(QualificationStage.QUOTED, 0));

      assertThat(evaluator.evaluate(longEnough, lead(), NOW, null).checkpointKey())
          .startsWith("stage:QUALIFYING:");
      assertThat(evaluator.evaluate(tooSoon, lead(), NOW, null).matched()).isFalse();
      assertThat(evaluator.evaluate(otherStage, lead(), NOW, null).matched()).isFalse();
    }
  }

  @Nested
  @DisplayName("INBOUND_MESSAGE")
  class Inbound {

    private final AutomationRule rule =
        rule(
            "price_question",
            AutomationRule.EVENT,
            new TriggerCondition.InboundMessage(List.of("price", "cost"), List.of()));

    @Test
    @DisplayName("matches a keyword regardless of case and checkpoints on the message")
    void testKeyword() {
      InboundEvent event = new InboundEvent(70L, "wamid.1", "What is the PRICE?", NOW);

      ConditionMatch match = evaluator.evaluate(rule, lead(), NOW, event);

      assertThat(match.matched()).isTrue();
      assertThat(match.checkpointKey()).isEqualTo("inbound:wamid.1");
    }

    @Test
    @DisplayName("no event or no keyword does not match")
    void testNoMatch() {
      assertThat(evaluator.evaluate(rule, lead(), NOW, null).matched()).isFalse();
      assertThat(
              evaluator
                  .evaluate(rule, lead(), NOW, new InboundEvent(70L, "wamid.2", "thanks", NOW))
                  .matched())
          .isFalse();
    }

    @Test
    @DisplayName("the stage filter limits where the rule applies")
    void testStageFilter() {
      AutomationRule intakeOnly =
          rule(
              "intake_price",
              AutomationRule.EVENT,
              new TriggerCondition.InboundMessage(List.of("price"), List.of(QualificationStage.INTAKE)));

      ConditionMatch match =
          evaluator.evaluate(intakeOnly, lead(), NOW, new InboundEvent(70L, "wamid.3", "price?", NOW));

      assertThat(match.matched()).isFalse();
    }
  }

  @Test
  @DisplayName("a negative reminder window is rejected")
  void testNegativeWindow() {
    assertThatThrownBy(() -> new ConditionEvaluator(-1)).isInstanceOf(IllegalArgumentException.class);
  }
}
