package com.acme.stickers.worker;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.stickers.core.DependencyWaiter;
import com.acme.stickers.core.TransientException;
import com.acme.stickers.persistence.jdbc.SchemaMigrator;
import com.acme.stickers.spi.SubmissionQueue;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("StartupDependencyCheck Tests")
class StartupDependencyCheckTest {

  @Mock private DataSource dataSource;
  @Mock private Connection connection;
  @Mock private SchemaMigrator migrator;
  @Mock private SubmissionQueue queue;

  private StartupDependencyCheck check;

  @BeforeEach
  void setUp() {
    DependencyWaiter waiter = new DependencyWaiter(3, Duration.ofMillis(1), d -> {});
    check = new StartupDependencyCheck(waiter, dataSource, migrator, queue);
  }

  @Test
  @DisplayName("waits for the database, migrates once, then pings Redis")
  void testDatabaseComesUpLate() throws SQLException {
    // Given: PostgreSQL refuses the first two connections
    when(dataSource.getConnection())
        .thenThrow(new SQLException("Connection refused", "08001"))
        .thenThrow(new SQLException("Connection refused", "08001"))
        .thenReturn(connection);

    // When
    boolean ready = check.awaitDependencies();

    // Then
    assertThat(ready).isTrue();
    verify(migrator, times(1)).migrate();
    verify(connection).close();
    verify(queue).ping();
  }

  @Test
  @DisplayName("database that never comes up fails before Redis is tried")
  void testDatabaseNeverUp() throws SQLException {
    when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

    assertThat(check.awaitDependencies()).isFalse();
    verify(dataSource, times(3)).getConnection();
    verifyNoInteractions(migrator, queue);
  }

  @Test
  @DisplayName("failed migration is retried like a failed connection")
  void testMigrationRetried() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(migrator.migrate()).thenThrow(new IllegalStateException("locked")).thenReturn(1);

    assertThat(check.awaitDependencies()).isTrue();
    verify(migrator, times(2)).migrate();
  }

  @Test
  @DisplayName("Redis that never answers fails the check")
  void testRedisNeverUp() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    doThrow(new TransientException("Redis unreachable")).when(queue).ping();

    assertThat(check.awaitDependencies()).isFalse();
    verify(queue, times(3)).ping();
  }
}
