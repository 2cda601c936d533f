package callcampaign.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>When a schema is configured, every connection is switched to it before use, so the campaign
 * tables can live outside the data source's default schema without qualifying their names.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;
  private final String schema;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this(dataSource, null);
  }

  /**
   * @param dataSource the data source
   * @param schema     schema holding the campaign tables, or null/blank for the default one
   * @throws IllegalArgumentException if {@code schema} is not a plain SQL identifier
   */
  public DataSourceConnectionProvider(DataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.schema = schema == null || schema.isBlank() ? null : TableNames.validate(schema.trim());
  }

  public Optional<String> schema() {
    return Optional.ofNullable(schema);
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    if (schema != null) {
      try {
        conn.setSchema(schema);
      } catch (SQLException e) {
        try {
          conn.close();
        } catch (SQLException closeFailure) {
          e.addSuppressed(closeFailure);
        }
        throw e;
      }
    }
    return conn;
  }
}
