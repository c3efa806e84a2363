package com.acme.crm.spi;

import com.acme.crm.domain.LeadPriority;
import com.acme.crm.domain.LeadSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Read side of the lead store plus the two fields automation is allowed to change. */
public interface LeadGateway {

  /**
   * Open leads to evaluate scheduled rules against
   *
   * @param limit maximum number of leads
   */
  List<LeadSnapshot> findCandidates(int limit);

  Optional<LeadSnapshot> findById(long leadId);

  Optional<LeadSnapshot> findByConversation(long conversationId);

  void updateNextFollowUp(long leadId, Instant nextFollowUpAt);

  void updatePriority(long leadId, LeadPriority priority);
}
