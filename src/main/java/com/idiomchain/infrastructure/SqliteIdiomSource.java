package com.idiomchain.infrastructure;

import com.idiomchain.domain.IdiomGraph;
import com.idiomchain.domain.IdiomGraphLoader;
import com.idiomchain.domain.LoadOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

/**
 * Idioms read from a read-only SQLite database.
 *
 * <p>Each row of the configured query is one candidate line (its first column); NULL values are
 * treated like blank lines. The connection is opened read-only with {@code query_only=ON} and
 * closed as soon as the graph is built.
 */
public class SqliteIdiomSource implements IdiomSource {
  private static final Logger log = LoggerFactory.getLogger(SqliteIdiomSource.class);
  private static final String PREFIX = "jdbc:sqlite:";

  private final String jdbcUrl;
  private final String query;

  public SqliteIdiomSource(String jdbcUrl, String query) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    this.query = Objects.requireNonNull(query, "query");
  }

  @Override
  public IdiomGraph load(LoadOptions options) throws IOException {
    if (jdbcUrl.startsWith(PREFIX)) {
      String path = jdbcUrl.substring(PREFIX.length());
      if (!path.startsWith(":")) {
        Path db = Path.of(path).toAbsolutePath().normalize();
        if (Files.notExists(db)) throw new IllegalStateException("Idiom DB not found: " + db);
      }
    }

    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setReadOnly(true);
    cfg.setOpenMode(SQLiteOpenMode.READONLY);

    try (Connection conn = DriverManager.getConnection(jdbcUrl, cfg.toProperties());
        Statement s = conn.createStatement()) {
      conn.setReadOnly(true);
      s.execute("PRAGMA query_only=ON");
      s.execute("PRAGMA temp_store=MEMORY");
      log.debug("Reading idioms with: {}", query);
      try (ResultSet rs = s.executeQuery(query)) {
        return IdiomGraphLoader.load(() -> nextRow(rs), options);
      }
    } catch (SQLException e) {
      throw new IOException("Reading idioms from " + jdbcUrl + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String describe() {
    return jdbcUrl;
  }

  private static String nextRow(ResultSet rs) throws IOException {
    try {
      if (!rs.next()) return null;
      String value = rs.getString(1);
      return value == null ? "" : value;
    } catch (SQLException e) {
      throw new IOException("Reading idiom row failed: " + e.getMessage(), e);
    }
  }
}
