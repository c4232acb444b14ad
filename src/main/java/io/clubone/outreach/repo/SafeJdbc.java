package io.clubone.outreach.repo;

import io.clubone.outreach.outreach.exception.DataStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Best-effort JDBC access for the outreach run path.
 * Reads degrade to an empty list and writes report false instead of propagating,
 * only {@link #probe()} signals that the store is unreachable.
 */
@Component
public class SafeJdbc {

  private static final Logger log = LoggerFactory.getLogger(SafeJdbc.class);

  private final JdbcTemplate jdbc;

  public SafeJdbc(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  public JdbcTemplate jdbc() {
    return jdbc;
  }

  public void probe() {
    try {
      jdbc.queryForObject("SELECT 1", Integer.class);
    } catch (DataAccessException e) {
      throw new DataStoreUnavailableException("Data store unreachable: " + e.getMessage(), e);
    }
  }

  /**
   * Rows mapped to null are dropped.
   */
  public <T> List<T> selectMany(String label, String sql, RowMapper<T> mapper, Object... args) {
    try {
      return jdbc.query(sql, mapper, args).stream()
          .filter(Objects::nonNull)
          .collect(Collectors.toList());
    } catch (DataAccessException e) {
      log.warn("Read degraded to empty result (non-blocking): source={} error={}", label, e.getMessage());
      log.debug("Read failure details", e);
      return List.of();
    }
  }

  public boolean insert(String label, String sql, Object... args) {
    try {
      return jdbc.update(sql, args) > 0;
    } catch (DataAccessException e) {
      log.warn("Insert skipped (non-blocking): target={} error={}", label, e.getMessage());
      log.debug("Insert failure details", e);
      return false;
    }
  }

  /**
   * @return rows affected, or -1 when the statement failed
   */
  public int update(String label, String sql, Object... args) {
    try {
      return jdbc.update(sql, args);
    } catch (DataAccessException e) {
      log.warn("Update skipped (non-blocking): target={} error={}", label, e.getMessage());
      log.debug("Update failure details", e);
      return -1;
    }
  }

  public static Timestamp timestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  public static Instant instant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }
}
