package com.acme.stickers.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.stickers.core.PermanentException;
import com.acme.stickers.core.SubmissionEnvelope;
import com.acme.stickers.core.TransientException;
import com.acme.stickers.repository.RecordResult;
import com.acme.stickers.repository.WriteOutcome;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

/**
 * Runs the store against a database WITHOUT the schema, and against a data source that cannot
 * connect, to exercise the exception translation paths.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcSubmissionStoreFaultyTest {

  private HikariDataSource dataSource;

  @BeforeAll
  void setupFaultySchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:faultydb;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
    config.setDriverClassName("org.h2.Driver");
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(2);
    dataSource = new HikariDataSource(config);
    // No migration, so the tables don't exist
  }

  @AfterAll
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @Test
  @DisplayName("missing table surfaces as PermanentException")
  void testMissingTable() {
    JdbcSubmissionStore store = new JdbcSubmissionStore(dataSource);
    SubmissionEnvelope envelope = new SubmissionEnvelope("a", "A", "regular", "l", 1L);

    assertThatThrownBy(() -> store.record(envelope)).isInstanceOf(PermanentException.class);
  }

  @Test
  @DisplayName("unreachable database surfaces as TransientException")
  void testConnectionRefused() throws SQLException {
    DataSource unreachable = mock(DataSource.class);
    when(unreachable.getConnection())
        .thenThrow(new SQLException("Connection refused", "08001"));
    JdbcSubmissionStore store = new JdbcSubmissionStore(unreachable);

    assertThatThrownBy(() -> store.record(new SubmissionEnvelope("a", "A", "regular", "l", 1L)))
        .isInstanceOf(TransientException.class);
    assertThatThrownBy(store::ping).isInstanceOf(TransientException.class);
  }

  @Test
  @DisplayName("commit failure rolls the transaction back")
  void testCommitFailureRollsBack() throws SQLException {
    DataSource failing = mock(DataSource.class);
    Connection conn = mock(Connection.class);
    PreparedStatement ps = mock(PreparedStatement.class);
    ResultSet rs = mock(ResultSet.class);
    when(failing.getConnection()).thenReturn(conn);
    when(conn.getAutoCommit()).thenReturn(true);
    when(conn.prepareStatement(anyString())).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);
    // Pack and submission both found, so only the commit touches the database
    when(rs.next()).thenReturn(true);
    when(rs.getString("short_name")).thenReturn("a");
    when(rs.getString("sticker_type")).thenReturn("regular");
    doThrow(new SQLException("Connection reset", "08006")).when(conn).commit();
    JdbcSubmissionStore store = new JdbcSubmissionStore(failing);

    assertThatThrownBy(() -> store.record(new SubmissionEnvelope("a", "A", "regular", "l", 1L)))
        .isInstanceOf(TransientException.class);
    verify(conn).rollback();
    verify(conn).setAutoCommit(true);
  }

  @Test
  @DisplayName("failure to restore autoCommit after a commit does not fail the record")
  void testRestoreAutoCommitFailureAfterCommit() throws SQLException {
    Connection conn = foundPackAndSubmission();
    doNothing().doThrow(new SQLException("Connection reset", "08006")).when(conn).setAutoCommit(anyBoolean());
    JdbcSubmissionStore store = new JdbcSubmissionStore(dataSourceFor(conn));

    RecordResult result = store.record(new SubmissionEnvelope("a", "A", "regular", "l", 1L));

    assertThat(result.pack()).isEqualTo(WriteOutcome.ALREADY_EXISTS);
    assertThat(result.submission()).isEqualTo(WriteOutcome.ALREADY_EXISTS);
    verify(conn).commit();
    verify(conn, never()).rollback();
  }

  @Test
  @DisplayName("failure to restore autoCommit after a rollback keeps the original error")
  void testRestoreAutoCommitFailureAfterRollback() throws SQLException {
    Connection conn = foundPackAndSubmission();
    doThrow(new SQLException("Connection reset", "08006")).when(conn).commit();
    doNothing().doThrow(new SQLException("closed", "08003")).when(conn).setAutoCommit(anyBoolean());
    JdbcSubmissionStore store = new JdbcSubmissionStore(dataSourceFor(conn));

    assertThatThrownBy(() -> store.record(new SubmissionEnvelope("a", "A", "regular", "l", 1L)))
        .isInstanceOf(TransientException.class)
        .hasMessageContaining("Connection reset");
    verify(conn).rollback();
  }

  private static Connection foundPackAndSubmission() throws SQLException {
    Connection conn = mock(Connection.class);
    PreparedStatement ps = mock(PreparedStatement.class);
    ResultSet rs = mock(ResultSet.class);
    when(conn.getAutoCommit()).thenReturn(true);
    when(conn.prepareStatement(anyString())).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);
    when(rs.next()).thenReturn(true);
    when(rs.getString("short_name")).thenReturn("a");
    when(rs.getString("sticker_type")).thenReturn("regular");
    return conn;
  }

  private static DataSource dataSourceFor(Connection conn) throws SQLException {
    DataSource ds = mock(DataSource.class);
    when(ds.getConnection()).thenReturn(conn);
    return ds;
  }
}
