package com.acme.crm.domain;

public enum TriggerSource {
  SCHEDULED,
  MANUAL,
  EVENT
}
