package com.acme.crm.qualification;

import com.acme.crm.dispatch.DispatchResult;
import com.acme.crm.domain.Conversation;

/** What the orchestrator decided, the committed conversation, and the dispatch result if any. */
public record QualificationOutcome(
    QualificationIntent intent, Conversation conversation, DispatchResult dispatch) {

  public boolean replied() {
    return dispatch != null && dispatch.outcome().isSend();
  }
}
