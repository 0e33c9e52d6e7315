package notestore.jdbc;

import notestore.DuplicateEntityException;
import notestore.StorageUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in the store implementations.
 *
 * <p>{@link SQLException}s are rethrown unchecked: unique-key violations (SQLState
 * {@code 23505}) as {@link DuplicateEntityException}, everything else as
 * {@link StorageUnavailableException}.
 */
public final class JdbcTemplate {
  private static final String UNIQUE_VIOLATION = "23505";

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw translate("Failed to execute update", e);
    }
  }

  /** Execute the same statement once per parameter row as a JDBC batch. */
  public static void batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    if (rows.isEmpty()) {
      return;
    }
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] params : rows) {
        bindParams(ps, params);
        ps.addBatch();
      }
      ps.executeBatch();
    } catch (SQLException e) {
      throw translate("Failed to execute batch update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw translate("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to return at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> results = query(conn, sql, mapper, params);
    return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
  }

  /** Execute a single-value aggregate such as {@code COUNT(*)}. */
  public static long queryLong(Connection conn, String sql, Object... params) {
    return queryOne(conn, sql, rs -> rs.getLong(1), params).orElse(0L);
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
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(i + 1, bytes);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private static RuntimeException translate(String message, SQLException e) {
    if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
      return new DuplicateEntityException("Duplicate key: " + e.getMessage(), e);
    }
    return new StorageUnavailableException(message, e);
  }

  private JdbcTemplate() {}
}
