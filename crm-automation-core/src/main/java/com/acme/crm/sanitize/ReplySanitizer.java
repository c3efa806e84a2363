package com.acme.crm.sanitize;

import com.acme.crm.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes generator output into plain prose. Pure and idempotent: the text returned by {@link
 * #sanitize} never parses as JSON, so a second pass leaves it unchanged.
 */
public final class ReplySanitizer {

  /** Text-bearing fields in extraction priority order. */
  public static final List<String> TEXT_FIELDS =
      List.of("response", "message", "reply", "text", "answer");

  private static final int MAX_UNWRAP_DEPTH = 3;

  private static final Pattern FENCE =
      Pattern.compile("^```[a-zA-Z0-9_-]*\\s*\\R?(.*?)\\R?\\s*```$", Pattern.DOTALL);

  public SanitizedReply sanitize(String raw) {
    if (raw == null) {
      return new SanitizedReply("", false);
    }
    String text = raw.trim();
    boolean wasJson = false;
    for (int depth = 0; depth < MAX_UNWRAP_DEPTH; depth++) {
      JsonNode node = parseJson(text);
      if (node == null) {
        return new SanitizedReply(text, wasJson);
      }
      wasJson = true;
      text = extract(node);
    }
    // nested too deep: stop looking for text fields, only strip string quoting
    JsonNode node = parseJson(text);
    while (node != null && node.isTextual()) {
      text = node.asText().trim();
      node = parseJson(text);
    }
    return new SanitizedReply(node == null ? text : asPlainFallback(node), true);
  }

  private static JsonNode parseJson(String text) {
    String unfenced = unwrapFence(text);
    if (!looksLikeJson(unfenced)) {
      return null;
    }
    JsonNode node = Jsons.tryParse(unfenced);
    if (node == null || node.isMissingNode()) {
      return null;
    }
    return node;
  }

  private static String extract(JsonNode node) {
    if (node.isTextual()) {
      return node.asText().trim();
    }
    if (node.isObject()) {
      for (String field : TEXT_FIELDS) {
        JsonNode value = node.get(field);
        if (value != null && value.isTextual() && !value.asText().isBlank()) {
          return value.asText().trim();
        }
      }
    }
    return asPlainFallback(node);
  }

  /**
   * Stringified fallback for JSON without a known text field. Brackets become parentheses so the
   * result no longer parses as JSON.
   */
  private static String asPlainFallback(JsonNode node) {
    return Jsons.toJson(node)
        .replace('{', '(')
        .replace('}', ')')
        .replace('[', '(')
        .replace(']', ')');
  }

  private static String unwrapFence(String text) {
    Matcher m = FENCE.matcher(text);
    if (m.matches()) {
      return m.group(1).trim();
    }
    return text;
  }

  private static boolean looksLikeJson(String text) {
    if (text.isEmpty()) {
      return false;
    }
    char first = text.charAt(0);
    return first == '{' || first == '[' || first == '"';
  }
}
