/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core;

import dev.tabula.api.schema.ColumnInfo;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/** Read-only queries against SQLite's catalog. Results are never cached. */
final class SchemaInspector {

  private SchemaInspector() {}

  static boolean tableExists(Connection c, String table) throws SQLException {
    return objectExists(c, "table", table);
  }

  static boolean indexExists(Connection c, String index) throws SQLException {
    return objectExists(c, "index", index);
  }

  private static boolean objectExists(Connection c, String type, String name) throws SQLException {
    String sql = "SELECT COUNT(*) FROM sqlite_master WHERE type = ? AND name = ?";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, type);
      ps.setString(2, name);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() && rs.getInt(1) > 0;
      }
    }
  }

  /**
   * Live columns of {@code table}, hidden and generated ones included.
   *
   * @return columns in table order; empty if the table does not exist
   */
  static List<ColumnInfo> tableXinfo(Connection c, String table) throws SQLException {
    String sql =
        """
        SELECT cid, name, type, "notnull", dflt_value, pk, hidden
        FROM pragma_table_xinfo(?)
        ORDER BY cid
        """;
    List<ColumnInfo> columns = new ArrayList<>();
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, table);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          columns.add(
              new ColumnInfo(
                  rs.getInt(1),
                  rs.getString(2),
                  rs.getString(3),
                  rs.getInt(4) != 0,
                  rs.getString(5),
                  rs.getInt(6),
                  rs.getInt(7)));
        }
      }
    }
    return columns;
  }

  static int userVersion(Connection c) throws SQLException {
    try (Statement st = c.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA user_version")) {
      return rs.next() ? rs.getInt(1) : 0;
    }
  }

  static void setUserVersion(Connection c, int version) throws SQLException {
    try (Statement st = c.createStatement()) {
      st.executeUpdate("PRAGMA user_version = " + version);
    }
  }

  static String engineVersion(Connection c) throws SQLException {
    try (Statement st = c.createStatement();
        ResultSet rs = st.executeQuery("SELECT sqlite_version()")) {
      return rs.next() ? rs.getString(1) : "";
    }
  }
}
