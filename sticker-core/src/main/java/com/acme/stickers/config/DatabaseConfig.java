package com.acme.stickers.config;

import java.time.Duration;

/**
 * Relational store connection settings. {@link #getJdbcUrl()} is built from host, port and
 * database unless an explicit url is configured.
 */
public class DatabaseConfig {

  private String url;
  private String host = "localhost";
  private int port = 5432;
  private String database = "sticker_collector";
  private String username = "bot_user";
  private String password = "";
  private String dialect = "PostgreSQL";
  private int maximumPoolSize = 10;
  private Duration connectionTimeout = Duration.ofSeconds(10);
  private Duration socketTimeout = Duration.ofSeconds(30);

  public String getJdbcUrl() {
    if (url != null && !url.isBlank()) {
      return url;
    }
    return "jdbc:postgresql://" + host + ":" + port + "/" + database;
  }

  public boolean isH2() {
    return "H2".equalsIgnoreCase(dialect);
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public String getDatabase() {
    return database;
  }

  public void setDatabase(String database) {
    this.database = database;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public int getMaximumPoolSize() {
    return maximumPoolSize;
  }

  public void setMaximumPoolSize(int maximumPoolSize) {
    this.maximumPoolSize = maximumPoolSize;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public Duration getSocketTimeout() {
    return socketTimeout;
  }

  public void setSocketTimeout(Duration socketTimeout) {
    this.socketTimeout = socketTimeout;
  }
}
