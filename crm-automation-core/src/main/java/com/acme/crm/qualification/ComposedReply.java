package com.acme.crm.qualification;

/** A reply ready for dispatch and where its text came from. */
public record ComposedReply(String text, Source source, boolean wasJson) {

  public enum Source {
    GENERATED,
    TEMPLATE,
    NONE
  }

  public static ComposedReply none() {
    return new ComposedReply(null, Source.NONE, false);
  }

  public boolean isEmpty() {
    return source == Source.NONE || text == null || text.isBlank();
  }
}
