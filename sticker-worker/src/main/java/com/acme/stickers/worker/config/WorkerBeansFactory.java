package com.acme.stickers.worker.config;

import com.acme.stickers.config.DatabaseConfig;
import com.acme.stickers.config.QueueConfig;
import com.acme.stickers.config.StartupConfig;
import com.acme.stickers.core.DependencyWaiter;
import com.acme.stickers.persistence.jdbc.JdbcSubmissionStore;
import com.acme.stickers.persistence.jdbc.SchemaMigrator;
import com.acme.stickers.repository.SubmissionStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/**
 * Wires the worker's framework-free components. The config POJOs live in sticker-core and are
 * bound here from application.yml, so the core module stays free of Micronaut.
 */
@Factory
public class WorkerBeansFactory {

  /** Queue name, poll timeout and consumer thread count from {@code queue.*} */
  @Singleton
  @ConfigurationProperties("queue")
  public QueueConfig queueConfig() {
    return new QueueConfig();
  }

  /** Attempt budget for the startup waits from {@code startup.*} */
  @Singleton
  @ConfigurationProperties("startup")
  public StartupConfig startupConfig() {
    return new StartupConfig();
  }

  /** PostgreSQL connection settings from {@code datasource.*} */
  @Singleton
  @ConfigurationProperties("datasource")
  public DatabaseConfig databaseConfig() {
    return new DatabaseConfig();
  }

  /**
   * Connection pool that does not touch the database on creation. The first connection is taken
   * by the startup check, which retries while PostgreSQL is still coming up.
   */
  @Singleton
  @Bean(preDestroy = "close")
  public HikariDataSource dataSource(DatabaseConfig config) {
    return new HikariDataSource(hikariConfig(config));
  }

  @Singleton
  public SubmissionStore submissionStore(DataSource dataSource) {
    return new JdbcSubmissionStore(dataSource);
  }

  @Singleton
  public SchemaMigrator schemaMigrator(DataSource dataSource, DatabaseConfig config) {
    return new SchemaMigrator(dataSource, config.isH2());
  }

  @Singleton
  public DependencyWaiter dependencyWaiter(StartupConfig config) {
    return new DependencyWaiter(config);
  }

  static HikariConfig hikariConfig(DatabaseConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("sticker-worker");
    hikari.setJdbcUrl(config.getJdbcUrl());
    hikari.setUsername(config.getUsername());
    hikari.setPassword(config.getPassword());
    hikari.setMaximumPoolSize(config.getMaximumPoolSize());
    hikari.setConnectionTimeout(config.getConnectionTimeout().toMillis());
    hikari.setInitializationFailTimeout(-1);
    if (!config.isH2()) {
      hikari.addDataSourceProperty(
          "socketTimeout", String.valueOf(config.getSocketTimeout().toSeconds()));
    }
    return hikari;
  }
}
