package com.acme.crm.domain;

public enum LeadPriority {
  LOW,
  NORMAL,
  HIGH,
  URGENT
}
