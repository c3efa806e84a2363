package com.acme.crm.qualification;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Question keys and phrase fragments that must never reach a customer. Retired question types
 * ("new or renewal", "company name") are listed here so they cannot resurface from templates or
 * generated text.
 */
public final class BannedContentPolicy {

  public static final Set<String> DEFAULT_KEYS =
      Set.of(
          "new_or_renewal",
          "new_or_renew",
          "company_name",
          "companyName",
          "ask_company",
          "ask_company_name",
          "ask_new_or_renew");

  public static final List<String> DEFAULT_PHRASES =
      List.of(
          "new or renewal",
          "new or renew",
          "renewal or new",
          "company name",
          "name of your company");

  private final Set<String> bannedKeys;
  private final List<String> bannedPhrases;

  public BannedContentPolicy(Set<String> bannedKeys, List<String> bannedPhrases) {
    this.bannedKeys =
        bannedKeys.stream().map(BannedContentPolicy::normalizeKey).collect(Collectors.toSet());
    this.bannedPhrases =
        bannedPhrases.stream().map(p -> p.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
  }

  public static BannedContentPolicy defaults() {
    return new BannedContentPolicy(DEFAULT_KEYS, DEFAULT_PHRASES);
  }

  /** Keys compare case-insensitively and ignore separators, so companyName equals company_name. */
  public boolean isBannedKey(String questionKey) {
    return questionKey != null && bannedKeys.contains(normalizeKey(questionKey));
  }

  public Optional<String> findBannedPhrase(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return bannedPhrases.stream().filter(lower::contains).findFirst();
  }

  public boolean containsBannedPhrase(String text) {
    return findBannedPhrase(text).isPresent();
  }

  static String normalizeKey(String key) {
    return key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
  }
}
