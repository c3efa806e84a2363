package com.acme.crm.processor.config;

import com.acme.crm.config.AutomationConfig;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment to avoid configuration errors.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final AutomationConfig config;

    @Property(name = "db.dialect")
    private String dialect;

    @Property(name = "datasources.default.url")
    private String datasourceUrl;

    @Property(name = "datasources.default.maximum-pool-size", defaultValue = "10")
    private int maxPoolSize;

    @Property(name = "whatsapp.base-url", defaultValue = "")
    private String whatsappBaseUrl;

    @Property(name = "text-generator.model", defaultValue = "")
    private String generatorModel;

    public ConfigurationLogger(AutomationConfig config) {
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Database Configuration ━━━");
        LOG.info("  Dialect:            {} (Selects the H2 or PostgreSQL repositories)", dialect);
        LOG.info("  JDBC URL:           {}", datasourceUrl);
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
        LOG.info("");

        LOG.info("━━━ Outbound Jobs ━━━");
        LOG.info("  Runner Id:          {} (Written to claimed_by on every claimed job)", config.getRunnerId());
        LOG.info("  Sweep Interval:     {} (Delay between job runner passes)", config.getJobSweepInterval());
        LOG.info("  Batch Size:         {} (Jobs claimed per pass)", config.getJobBatchSize());
        LOG.info("  Max Attempts:       {} (Sends before a job is marked FAILED)", config.getMaxAttempts());
        LOG.info("  Backoff:            {} doubling, capped at {}", config.getBackoffBase(), config.getMaxBackoff());
        LOG.info("  Stale Claim:        {} (PROCESSING jobs older than this are failed)", config.getStaleClaimTimeout());
        LOG.info("  Send Timeout:       {}", config.getSendTimeout());
        LOG.info("");

        LOG.info("━━━ Automation Rules ━━━");
        LOG.info("  Cool-down:          {} minutes between automated sends per conversation", config.getCooldownMinutes());
        LOG.info("  Reminder Window:    {} days", config.getReminderWindowDays());
        LOG.info("  Candidate Limit:    {} leads per scheduled pass", config.getCandidateLimit());
        LOG.info("  Max Questions:      {} before hand-off", config.getMaxQuestions());
        LOG.info("");

        LOG.info("━━━ Integrations ━━━");
        LOG.info("  WhatsApp:           {}", whatsappBaseUrl.isBlank() ? "not configured (log-only sends)" : whatsappBaseUrl);
        LOG.info("  Text Generator:     {}", generatorModel.isBlank() ? "not configured (catalog templates)" : generatorModel);
        LOG.info("  Generation Timeout: {}", config.getGenerationTimeout());
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
