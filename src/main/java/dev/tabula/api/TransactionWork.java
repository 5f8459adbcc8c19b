/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

/** Work executed by {@link Storage#transaction(TransactionWork)}. */
@FunctionalInterface
public interface TransactionWork {
  /**
   * Runs inside an open transaction.
   *
   * @return {@code true} to commit, {@code false} to roll back
   */
  boolean run();
}
