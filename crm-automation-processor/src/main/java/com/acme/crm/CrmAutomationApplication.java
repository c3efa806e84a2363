package com.acme.crm;

import io.micronaut.runtime.Micronaut;

/**
 * Automation processor. Runs the outbound job sweeper and the scheduled rule passes, and answers
 * inbound customer messages through the qualification flow. Any number of instances may share one
 * database.
 */
public class CrmAutomationApplication {
    public static void main(String[] args) {
        Micronaut.run(CrmAutomationApplication.class, args);
    }
}
