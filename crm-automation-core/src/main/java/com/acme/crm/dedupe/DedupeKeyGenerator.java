package com.acme.crm.dedupe;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives idempotency keys for outbound messages and tasks.
 *
 * <p>The key is the SHA-256 hex of {@code conv:<id>|intent:<intent>|bucket:<label>}. The only time
 * input is the instant passed in, truncated to the bucket, so the same logical trigger re-run within
 * a bucket always maps to the same key.
 */
public final class DedupeKeyGenerator {

  private static final int TEXT_HASH_LENGTH = 16;
  private static final int PREFIX_LENGTH = 12;

  public String key(long conversationId, String intent, TimeBucket bucket, Instant at) {
    String material =
        "conv:" + conversationId + "|intent:" + normalize(intent) + "|bucket:" + bucket.label(at);
    return sha256(material);
  }

  /** Key for a task created on behalf of a lead, which may not have a conversation yet. */
  public String taskKey(long leadId, String intent, Instant at) {
    return sha256(
        "lead:" + leadId + "|intent:" + normalize(intent) + "|bucket:" + TimeBucket.DAY.label(at));
  }

  /** Key for the reply to one specific inbound provider message. */
  public String inboundReplyKey(long conversationId, String providerMessageId) {
    return key(conversationId, "inbound:" + providerMessageId, TimeBucket.NONE, null);
  }

  /** Key for free text, where the body itself distinguishes logical messages within a bucket. */
  public String textKey(
      long conversationId, String intent, String text, TimeBucket bucket, Instant at) {
    String textHash = sha256(text == null ? "" : text.trim()).substring(0, TEXT_HASH_LENGTH);
    return key(conversationId, normalize(intent) + "|text:" + textHash, bucket, at);
  }

  /** Key for re-enqueueing a failed job as a new job. Stable per generation. */
  public String derive(String originalKey, int generation) {
    if (generation < 1) {
      throw new IllegalArgumentException("generation must be positive: " + generation);
    }
    return sha256(originalKey + "|requeue:" + generation);
  }

  /** Short form for logs and job views. */
  public static String prefix(String key) {
    if (key == null) {
      return null;
    }
    return key.length() <= PREFIX_LENGTH ? key : key.substring(0, PREFIX_LENGTH);
  }

  static String normalize(String intent) {
    if (intent == null || intent.isBlank()) {
      throw new IllegalArgumentException("intent is required");
    }
    return intent.trim().toLowerCase(Locale.ROOT);
  }

  private static String sha256(String material) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
