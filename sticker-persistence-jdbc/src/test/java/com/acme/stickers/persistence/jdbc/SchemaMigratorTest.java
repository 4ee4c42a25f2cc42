package com.acme.stickers.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SchemaMigratorTest extends H2StoreTestBase {

  @Test
  @DisplayName("running the migrator again applies nothing")
  void testIdempotentMigration() {
    assertThat(new SchemaMigrator(dataSource, true).migrate()).isZero();
  }

  @Test
  @DisplayName("schema enforces unique short_name")
  void testShortNameUnique() throws SQLException {
    clearTables();
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement()) {
      st.execute(
          "INSERT INTO sticker_packs (short_name, name, sticker_type, link) VALUES ('x', 'X', 'regular', 'l')");

      assertThatThrownBy(
              () ->
                  st.execute(
                      "INSERT INTO sticker_packs (short_name, name, sticker_type, link)"
                          + " VALUES ('x', 'Y', 'mask', 'l')"))
          .isInstanceOfSatisfying(
              SQLException.class,
              e -> assertThat(ExceptionTranslator.isUniqueViolation(e)).isTrue());
    }
  }

  @Test
  @DisplayName("schema enforces unique (user_id, sticker_pack_id)")
  void testSubmissionPairUnique() throws SQLException {
    clearTables();
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement()) {
      st.execute(
          "INSERT INTO sticker_packs (id, short_name, name, sticker_type, link) VALUES (900, 'y', 'Y', 'regular', 'l')");
      st.execute("INSERT INTO user_sticker_submissions (user_id, sticker_pack_id) VALUES (1, 900)");
      st.execute("INSERT INTO user_sticker_submissions (user_id, sticker_pack_id) VALUES (2, 900)");

      assertThatThrownBy(
              () ->
                  st.execute(
                      "INSERT INTO user_sticker_submissions (user_id, sticker_pack_id) VALUES (1, 900)"))
          .isInstanceOfSatisfying(
              SQLException.class,
              e -> assertThat(ExceptionTranslator.isUniqueViolation(e)).isTrue());
    }
  }
}
