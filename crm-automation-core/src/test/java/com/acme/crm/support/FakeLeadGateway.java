package com.acme.crm.support;

import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.LeadSnapshot;
import com.acme.crm.spi.LeadGateway;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Lead store backed by a map; updates are recorded and can be made to fail. */
public class FakeLeadGateway implements LeadGateway {

  private final Map<Long, LeadSnapshot> leads = new LinkedHashMap<>();
  public final Map<Long, Instant> followUps = new HashMap<>();
  public final Map<Long, LeadPriority> priorities = new HashMap<>();
  private RuntimeException priorityFailure;

  public FakeLeadGateway add(LeadSnapshot lead) {
    leads.put(lead.leadId(), lead);
    return this;
  }

  public void failPriorityUpdatesWith(RuntimeException failure) {
    this.priorityFailure = failure;
  }

  @Override
  public List<LeadSnapshot> findCandidates(int limit) {
    return new ArrayList<>(leads.values()).stream().limit(limit).toList();
  }

  @Override
  public Optional<LeadSnapshot> findById(long leadId) {
    return Optional.ofNullable(leads.get(leadId));
  }

  @Override
  public Optional<LeadSnapshot> findByConversation(long conversationId) {
    return leads.values().stream()
        .filter(l -> Objects.equals(l.conversationId(), conversationId))
        .findFirst();
  }

  @Override
  public void updateNextFollowUp(long leadId, Instant nextFollowUpAt) {
    followUps.put(leadId, nextFollowUpAt);
  }

  @Override
  public void updatePriority(long leadId, LeadPriority priority) {
    if (priorityFailure != null) {
      throw priorityFailure;
    }
    priorities.put(leadId, priority);
  }
}
