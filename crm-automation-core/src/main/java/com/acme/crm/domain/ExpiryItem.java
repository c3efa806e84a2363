package com.acme.crm.domain;

import java.time.LocalDate;

/** A dated document or contract tracked on a lead, e.g. a visa or trade licence. */
public record ExpiryItem(long id, String itemType, LocalDate expiryDate) {}
