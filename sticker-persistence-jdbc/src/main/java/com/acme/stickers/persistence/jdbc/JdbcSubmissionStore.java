package com.acme.stickers.persistence.jdbc;

import com.acme.stickers.core.SubmissionEnvelope;
import com.acme.stickers.core.TransientException;
import com.acme.stickers.domain.Pack;
import com.acme.stickers.domain.StickerType;
import com.acme.stickers.domain.Submission;
import com.acme.stickers.repository.RecordResult;
import com.acme.stickers.repository.SubmissionStore;
import com.acme.stickers.repository.WriteOutcome;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * JDBC implementation of {@link SubmissionStore}.
 *
 * <p>Each {@link #record} call runs in its own local transaction: find-or-insert the pack, then
 * find-or-insert the submission. The lookups and inserts are separate statements, so two writers
 * can both miss the lookup and race on the insert. The loser sees a unique violation; the
 * transaction is rolled back and replayed once, which then finds the winner's rows.
 */
@Slf4j
public class JdbcSubmissionStore implements SubmissionStore {

  static final int MAX_ATTEMPTS = 2;

  private static final String SELECT_PACK =
      """
      SELECT id, short_name, name, sticker_type, link, created_at
      FROM sticker_packs
      WHERE short_name = ?
      """;

  private static final String INSERT_PACK =
      """
      INSERT INTO sticker_packs (short_name, name, sticker_type, link, created_at)
      VALUES (?, ?, ?, ?, ?)
      """;

  private static final String SELECT_SUBMISSION =
      """
      SELECT id, user_id, sticker_pack_id, submitted_at
      FROM user_sticker_submissions
      WHERE user_id = ? AND sticker_pack_id = ?
      """;

  private static final String INSERT_SUBMISSION =
      """
      INSERT INTO user_sticker_submissions (user_id, sticker_pack_id, submitted_at)
      VALUES (?, ?, ?)
      """;

  private static final int PING_TIMEOUT_SECONDS = 5;

  protected final DataSource dataSource;
  private final Clock clock;

  public JdbcSubmissionStore(DataSource dataSource) {
    this(dataSource, Clock.systemUTC());
  }

  public JdbcSubmissionStore(DataSource dataSource, Clock clock) {
    this.dataSource = dataSource;
    this.clock = clock;
  }

  @Override
  public RecordResult record(SubmissionEnvelope envelope) {
    for (int attempt = 1; ; attempt++) {
      try {
        return recordInTransaction(envelope);
      } catch (SQLException e) {
        if (!ExceptionTranslator.isUniqueViolation(e)) {
          throw ExceptionTranslator.translateException(e, "record submission", log);
        }
        if (attempt >= MAX_ATTEMPTS) {
          log.info(
              "Unique violation persisted for pack {} and user {}, treating as already recorded",
              envelope.shortName(),
              envelope.userId());
          return new RecordResult(
              packIdOrZero(envelope.shortName()),
              WriteOutcome.ALREADY_EXISTS,
              WriteOutcome.ALREADY_EXISTS);
        }
        log.info(
            "Concurrent insert detected for pack {} and user {} (attempt {}/{}), replaying",
            envelope.shortName(),
            envelope.userId(),
            attempt,
            MAX_ATTEMPTS);
      }
    }
  }

  private RecordResult recordInTransaction(SubmissionEnvelope envelope) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        RecordResult result = applySubmission(conn, envelope);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    }
  }

  private RecordResult applySubmission(Connection conn, SubmissionEnvelope envelope)
      throws SQLException {
    WriteOutcome packOutcome;
    Optional<Pack> existing = findPack(conn, envelope.shortName());
    long packId;
    if (existing.isPresent()) {
      packId = existing.get().getId();
      packOutcome = WriteOutcome.ALREADY_EXISTS;
      log.debug("Sticker pack already exists: {} (ID: {})", envelope.shortName(), packId);
    } else {
      packId = insertPack(conn, envelope);
      packOutcome = WriteOutcome.INSERTED;
      log.info("Created new sticker pack: {} (ID: {})", envelope.name(), packId);
    }

    WriteOutcome submissionOutcome;
    if (findSubmission(conn, envelope.userId(), packId).isPresent()) {
      submissionOutcome = WriteOutcome.ALREADY_EXISTS;
      log.info("User {} already submitted sticker pack {}", envelope.userId(), envelope.shortName());
    } else {
      insertSubmission(conn, envelope.userId(), packId);
      submissionOutcome = WriteOutcome.INSERTED;
      log.info(
          "Recorded submission from user {} for sticker pack {}",
          envelope.userId(),
          envelope.shortName());
    }
    return new RecordResult(packId, packOutcome, submissionOutcome);
  }

  @Override
  public Optional<Pack> findPackByShortName(String shortName) {
    try (Connection conn = dataSource.getConnection()) {
      return queryPack(conn, shortName);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find pack by short name", log);
    }
  }

  @Override
  public Optional<Submission> findSubmission(long userId, long packId) {
    try (Connection conn = dataSource.getConnection()) {
      return findSubmission(conn, userId, packId);
    } catch (SQLException e) {
      throw ExceptionTranslator.translateException(e, "find submission", log);
    }
  }

  @Override
  public void ping() {
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.isValid(PING_TIMEOUT_SECONDS)) {
        throw new TransientException("Database connection is not valid");
      }
    } catch (SQLException e) {
      throw new TransientException("Database unreachable: " + e.getMessage(), e);
    }
  }

  /** Pack lookup inside a {@link #record} transaction. */
  protected Optional<Pack> findPack(Connection conn, String shortName) throws SQLException {
    return queryPack(conn, shortName);
  }

  private Optional<Pack> queryPack(Connection conn, String shortName) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(SELECT_PACK)) {
      ps.setString(1, shortName);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return Optional.of(mapPack(rs));
        }
      }
    }
    return Optional.empty();
  }

  protected Optional<Submission> findSubmission(Connection conn, long userId, long packId)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(SELECT_SUBMISSION)) {
      ps.setLong(1, userId);
      ps.setLong(2, packId);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return Optional.of(
              new Submission(
                  rs.getLong("id"),
                  rs.getLong("user_id"),
                  rs.getLong("sticker_pack_id"),
                  toInstant(rs.getTimestamp("submitted_at"))));
        }
      }
    }
    return Optional.empty();
  }

  private long insertPack(Connection conn, SubmissionEnvelope envelope) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(INSERT_PACK, Statement.RETURN_GENERATED_KEYS)) {
      ps.setString(1, envelope.shortName());
      ps.setString(2, envelope.name());
      ps.setString(3, envelope.kind().wireValue());
      ps.setString(4, Pack.linkFor(envelope.shortName()));
      ps.setTimestamp(5, Timestamp.from(Instant.now(clock)));
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("No key generated for sticker pack " + envelope.shortName());
        }
        return keys.getLong(1);
      }
    }
  }

  private void insertSubmission(Connection conn, long userId, long packId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(INSERT_SUBMISSION)) {
      ps.setLong(1, userId);
      ps.setLong(2, packId);
      ps.setTimestamp(3, Timestamp.from(Instant.now(clock)));
      ps.executeUpdate();
    }
  }

  private long packIdOrZero(String shortName) {
    return findPackByShortName(shortName).map(Pack::getId).orElse(0L);
  }

  private static Pack mapPack(ResultSet rs) throws SQLException {
    return new Pack(
        rs.getLong("id"),
        rs.getString("short_name"),
        rs.getString("name"),
        StickerType.fromWire(rs.getString("sticker_type")),
        rs.getString("link"),
        toInstant(rs.getTimestamp("created_at")));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  /** The transaction outcome is already decided here, so a failure only gets logged. */
  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      log.warn("Failed to restore autoCommit={} on connection: {}", autoCommit, e.getMessage());
    }
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
      log.warn("Rollback failed: {}", rollbackFailure.getMessage());
    }
  }
}
