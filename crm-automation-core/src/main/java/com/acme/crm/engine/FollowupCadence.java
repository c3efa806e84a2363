package com.acme.crm.engine;

import com.acme.crm.dedupe.DedupeKeyGenerator;
import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.domain.TaskAssignee;
import com.acme.crm.domain.TaskRequest;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Plans a fixed series of follow-up tasks after an anchor instant. Each task is due at {@link
 * #DUE_TIME} UTC on anchor day + offset, and its key depends only on the lead, the title prefix,
 * the offset and the anchor day.
 */
class FollowupCadence {

  static final LocalTime DUE_TIME = LocalTime.of(10, 0);

  private final DedupeKeyGenerator dedupeKeys;

  FollowupCadence(DedupeKeyGenerator dedupeKeys) {
    this.dedupeKeys = dedupeKeys;
  }

  List<TaskRequest> plan(
      LeadSnapshot lead,
      List<Integer> cadenceDays,
      String titlePrefix,
      String taskType,
      Instant anchor) {
    List<TaskRequest> tasks = new ArrayList<>(cadenceDays.size());
    for (int i = 0; i < cadenceDays.size(); i++) {
      int days = cadenceDays.get(i);
      Instant dueAt =
          anchor
              .atZone(ZoneOffset.UTC)
              .toLocalDate()
              .plusDays(days)
              .atTime(DUE_TIME)
              .toInstant(ZoneOffset.UTC);
      tasks.add(
          new TaskRequest(
              dedupeKeys.taskKey(lead.leadId(), "cadence:" + titlePrefix + ":" + days, anchor),
              lead.leadId(),
              lead.conversationId(),
              titlePrefix + " D+" + days,
              taskType,
              TaskAssignee.OWNER,
              priorityFor(i),
              dueAt));
    }
    return tasks;
  }

  // Earliest touch matters most.
  static LeadPriority priorityFor(int position) {
    if (position == 0) {
      return LeadPriority.HIGH;
    }
    return position == 1 ? LeadPriority.NORMAL : LeadPriority.LOW;
  }
}
