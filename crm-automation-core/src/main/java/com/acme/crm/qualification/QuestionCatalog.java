package com.acme.crm.qualification;

import com.acme.crm.domain.QualificationStage;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Required fields per stage in priority order, plus the reply templates used by the state machine
 * and by automated follow-ups. Only INTAKE and QUALIFYING are gated on fields; later stages move
 * on events such as a quote being sent.
 */
public final class QuestionCatalog {

  public static final String GENERIC_PROMPT = "generic_prompt";
  public static final String HANDOFF = "handoff";
  public static final String DEFAULT_SERVICE = "default";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_]+)}");

  private final Map<QualificationStage, List<QuestionDefinition>> byStage;
  private final Map<String, List<QuestionDefinition>> qualifyingByService;
  private final Map<String, String> templates;

  public QuestionCatalog(
      Map<QualificationStage, List<QuestionDefinition>> byStage,
      Map<String, List<QuestionDefinition>> qualifyingByService,
      Map<String, String> templates) {
    this.byStage = new EnumMap<>(byStage);
    this.qualifyingByService = new HashMap<>(qualifyingByService);
    this.templates = new HashMap<>(templates);
    if (!this.qualifyingByService.containsKey(DEFAULT_SERVICE)) {
      throw new IllegalArgumentException("qualifying questions need a default service entry");
    }
  }

  public static QuestionCatalog standard() {
    Map<QualificationStage, List<QuestionDefinition>> byStage =
        new EnumMap<>(QualificationStage.class);
    byStage.put(
        QualificationStage.INTAKE,
        List.of(
            new QuestionDefinition("name", "ask_name", "May I have your name, please?"),
            new QuestionDefinition(
                "service",
                "ask_service",
                "Which service can we help you with? For example business setup, visas or document renewals."),
            new QuestionDefinition(
                "nationality", "ask_nationality", "Thanks {name}. What is your nationality?")));

    Map<String, List<QuestionDefinition>> byService = new HashMap<>();
    byService.put(
        "business_setup",
        List.of(
            new QuestionDefinition(
                "businessActivity",
                "ask_business_activity",
                "What business activity are you planning?"),
            new QuestionDefinition(
                "mainlandOrFreezone",
                "ask_mainland_or_freezone",
                "Are you considering a mainland or a free zone company?"),
            new QuestionDefinition(
                "partnersCount",
                "ask_partners_count",
                "How many partners or shareholders will there be?"),
            new QuestionDefinition(
                "visasCount", "ask_visas_count", "How many residence visas will you need?")));
    byService.put(
        DEFAULT_SERVICE,
        List.of(
            new QuestionDefinition(
                "expiryDate",
                "ask_expiry_date",
                "When does your current {service} document expire?")));

    Map<String, String> templates = new HashMap<>();
    templates.put(
        "advance_intake", "Thank you {name}! Just a few quick details so we can help you properly.");
    templates.put(
        "advance_qualifying",
        "Thank you, that is everything we need for now. We will share the details and pricing with you shortly.");
    templates.put(GENERIC_PROMPT, "Could you tell us a little more about what you need help with?");
    templates.put(
        HANDOFF,
        "Thanks for your patience. One of our consultants will take it from here and get back to you shortly.");
    templates.put(
        "expiry_reminder",
        "Hi {name}, a quick reminder that your {itemType} expires on {expiryDate}. Would you like us to take care of the renewal?");
    templates.put(
        "info_followup",
        "Hi {name}, did you get a chance to look at the information we shared? Happy to answer any questions.");
    templates.put(
        "reengagement",
        "Hi {name}, just checking in. Is there anything we can help you with today?");
    templates.put(
        "quote_followup",
        "Hi {name}, following up on the quotation we sent. Would you like to go ahead?");
    return new QuestionCatalog(byStage, byService, templates);
  }

  public boolean isFieldGated(QualificationStage stage) {
    return stage == QualificationStage.INTAKE || stage == QualificationStage.QUALIFYING;
  }

  /** Required fields of {@code stage} in priority order. QUALIFYING depends on the chosen service. */
  public List<QuestionDefinition> requiredFor(
      QualificationStage stage, Map<String, String> knownFields) {
    if (stage == QualificationStage.QUALIFYING) {
      String service = normalizeService(knownFields.get("service"));
      return qualifyingByService.getOrDefault(service, qualifyingByService.get(DEFAULT_SERVICE));
    }
    return byStage.getOrDefault(stage, List.of());
  }

  public boolean hasTemplate(String templateKey) {
    return templateKey != null && templates.containsKey(templateKey);
  }

  /**
   * Renders a template by key.
   *
   * @throws IllegalArgumentException when the template is unknown
   */
  public String renderTemplate(String templateKey, Map<String, String> values) {
    String template = templates.get(templateKey);
    if (template == null) {
      throw new IllegalArgumentException("Unknown reply template: " + templateKey);
    }
    return render(template, values);
  }

  /** Substitutes {@code {field}} placeholders; unknown placeholders render as empty. */
  public static String render(String template, Map<String, String> values) {
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (m.find()) {
      String value = values.get(m.group(1));
      m.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value.trim()));
    }
    m.appendTail(out);
    return out.toString().replaceAll(" {2,}", " ").replace(" ,", ",").replace(" !", "!").trim();
  }

  static String normalizeService(String service) {
    if (service == null || service.isBlank()) {
      return DEFAULT_SERVICE;
    }
    return service.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
  }
}
