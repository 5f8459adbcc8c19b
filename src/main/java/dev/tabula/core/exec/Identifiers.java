/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

/** SQL identifier quoting. */
public final class Identifiers {

  private Identifiers() {}

  /** Wraps {@code name} in double quotes, doubling embedded quotes. */
  public static String quote(String name) {
    return '"' + name.replace("\"", "\"\"") + '"';
  }
}
