/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

/** Outcome of reconciling one declared table (or index) with the live database. */
public enum SyncResult {
  /** Live table matches the declaration; nothing was done. */
  ALREADY_IN_SYNC("already in sync"),

  /** Table did not exist and was created. */
  NEW_TABLE_CREATED("new table created"),

  /** Missing columns were appended with {@code ALTER TABLE ... ADD COLUMN}. */
  NEW_COLUMNS_ADDED("new columns added"),

  /** Undeclared live columns were removed. */
  OLD_COLUMNS_REMOVED("old excess columns removed"),

  /** Both of the above. */
  NEW_COLUMNS_ADDED_AND_OLD_COLUMNS_REMOVED("new columns added and old excess columns removed"),

  /** Table was rebuilt; rows were copied only when preservation was possible and requested. */
  DROPPED_AND_RECREATED("old table dropped and recreated");

  private final String description;

  SyncResult(String description) {
    this.description = description;
  }

  @Override
  public String toString() {
    return description;
  }
}
