package com.acme.stickers.persistence.jdbc;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates or upgrades the pack and submission tables with Flyway. Scripts live under
 * {@code db/migration/postgres} and {@code db/migration/h2}.
 *
 * <p>Databases that already hold the tables but no Flyway history are baselined at version 0, so
 * the idempotent V1 script still runs against them.
 */
public class SchemaMigrator {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

  private final DataSource dataSource;
  private final String location;

  public SchemaMigrator(DataSource dataSource, boolean h2) {
    this.dataSource = dataSource;
    this.location = h2 ? "classpath:db/migration/h2" : "classpath:db/migration/postgres";
  }

  /** Applies pending migrations and returns how many were executed. */
  public int migrate() {
    MigrateResult result =
        Flyway.configure()
            .dataSource(dataSource)
            .locations(location)
            .baselineOnMigrate(true)
            .baselineVersion("0")
            .load()
            .migrate();
    LOG.info(
        "Schema migrated from {}: {} migration(s) applied, now at version {}",
        location,
        result.migrationsExecuted,
        result.targetSchemaVersion);
    return result.migrationsExecuted;
  }
}
