package callcampaign.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/** Fresh in-memory H2 database with the shipped schema applied, optionally inside a named schema. */
final class H2Schema {

  private H2Schema() {}

  static JdbcDataSource newDatabase() throws SQLException, IOException {
    return newDatabase(null);
  }

  static JdbcDataSource newDatabase(String schema) throws SQLException, IOException {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    String ddl;
    try (InputStream in = H2Schema.class.getResourceAsStream("/schema/callcampaign.sql")) {
      if (in == null) {
        throw new IllegalStateException("schema/callcampaign.sql not on classpath");
      }
      ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      if (schema != null) {
        st.execute("CREATE SCHEMA " + schema);
        st.execute("SET SCHEMA " + schema);
      }
      for (String statement : ddl.split(";")) {
        if (!statement.isBlank()) {
          st.execute(statement);
        }
      }
    }
    return dataSource;
  }
}
