package com.acme.crm.qualification;

/** A required field, the key of the question that asks for it and the prompt text. */
public record QuestionDefinition(String field, String questionKey, String prompt) {}
