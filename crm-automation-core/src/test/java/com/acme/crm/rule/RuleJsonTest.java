package com.acme.crm.rule;

import static org.assertj.core.api.Assertions.*;

import com.acme.crm.core.Jsons;
import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.QualificationStage;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Rule JSON Tests")
class RuleJsonTest {

  @Test
  @DisplayName("conditions are stored tagged with their trigger type")
  void testConditionTag() {
    String json = Jsons.toJson(new TriggerCondition.ExpiryWindow(30, "visa", null));

    assertThat(json).contains("\"triggerType\":\"EXPIRY_WINDOW\"").contains("\"daysBefore\":30");
  }

  @Test
  @DisplayName("a stored condition reads back as its variant")
  void testConditionRead() {
    TriggerCondition condition =
        Jsons.fromJson(
            "{\"triggerType\":\"STAGE_REACHED\",\"stage\":\"QUOTED\",\"minDaysInStage\":3}",
            TriggerCondition.class);

    assertThat(condition).isEqualTo(new TriggerCondition.StageReached(QualificationStage.QUOTED, 3));
  }

  @Test
  @DisplayName("action lists keep their order and variants")
  void testActions() throws Exception {
    List<RuleAction> actions =
        List.of(
            new RuleAction.CreateAgentTask("urgent", LeadPriority.URGENT),
            new RuleAction.SetNextFollowup(3, true),
            new RuleAction.ScheduleFollowupCadence(List.of(3, 5), "Quote follow-up", "FOLLOW_UP"));

    String json =
        Jsons.mapper()
            .writerFor(Jsons.mapper().getTypeFactory().constructCollectionType(List.class, RuleAction.class))
            .writeValueAsString(actions);

    List<RuleAction> read = Jsons.listFromJson(json, RuleAction.class);

    assertThat(json)
        .contains("\"type\":\"CREATE_AGENT_TASK\"")
        .contains("\"type\":\"SCHEDULE_FOLLOWUP_CADENCE\"")
        .contains("\"cadenceDays\":[3,5]");

    assertThat(read).containsExactlyElementsOf(actions);
  }
}
