package com.acme.stickers.worker;

import com.acme.stickers.core.DependencyWaiter;
import com.acme.stickers.persistence.jdbc.SchemaMigrator;
import com.acme.stickers.spi.SubmissionQueue;
import jakarta.inject.Singleton;
import java.sql.Connection;
import javax.sql.DataSource;

/**
 * Blocks until PostgreSQL accepts connections and its schema is migrated, then until Redis
 * answers a ping. Each dependency gets the full attempt budget.
 */
@Singleton
public class StartupDependencyCheck {

  private final DependencyWaiter waiter;
  private final DataSource dataSource;
  private final SchemaMigrator migrator;
  private final SubmissionQueue queue;

  public StartupDependencyCheck(
      DependencyWaiter waiter, DataSource dataSource, SchemaMigrator migrator, SubmissionQueue queue) {
    this.waiter = waiter;
    this.dataSource = dataSource;
    this.migrator = migrator;
    this.queue = queue;
  }

  /** @return false if either dependency stayed unreachable */
  public boolean awaitDependencies() {
    boolean database =
        waiter.await(
            "PostgreSQL",
            () -> {
              try (Connection ignored = dataSource.getConnection()) {
                migrator.migrate();
              }
            });
    if (!database) {
      return false;
    }
    return waiter.await("Redis", queue::ping);
  }
}
