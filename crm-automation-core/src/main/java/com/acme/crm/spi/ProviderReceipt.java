package com.acme.crm.spi;

public record ProviderReceipt(String providerMessageId) {}
