/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

/** Generated-column storage kind. */
public enum Generated {
  NONE(0),
  VIRTUAL(2),
  STORED(3);

  private final int hidden;

  Generated(int hidden) {
    this.hidden = hidden;
  }

  /**
   * Value reported in the {@code hidden} column of {@code PRAGMA table_xinfo}.
   *
   * @return 0, 2 or 3
   */
  public int hidden() {
    return hidden;
  }
}
