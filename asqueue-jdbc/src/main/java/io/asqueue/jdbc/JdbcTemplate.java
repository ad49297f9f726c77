package io.asqueue.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in queue store implementations.
 *
 * <p>Every statement gets the given query timeout (seconds, {@code 0} for none). A
 * {@link SQLException} is rethrown as {@link QueueStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE/DELETE/DDL, return rows affected. */
  public static int update(Connection conn, int timeoutSeconds, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw QueueStoreException.translate("Failed to execute update", e);
    }
  }

  /** Execute INSERT, return the value the database generated for {@code keyColumn}. */
  public static long insertReturningKey(Connection conn, int timeoutSeconds, String keyColumn,
      String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql, new String[]{keyColumn})) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("Insert returned no generated key");
        }
        return keys.getLong(1);
      }
    } catch (SQLException e) {
      throw QueueStoreException.translate("Failed to execute insert", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, int timeoutSeconds, String sql,
      RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setQueryTimeout(timeoutSeconds);
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw QueueStoreException.translate("Failed to execute query", e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
