/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

import java.util.Iterator;

/**
 * Lazy iteration over mapped rows. Each {@link #next()} steps the underlying statement once; the
 * statement is finalized when the rows are exhausted or the cursor is closed, whichever comes
 * first. Use with try-with-resources when iteration may stop early.
 *
 * @param <T> mapped object type
 */
public interface RowCursor<T> extends Iterator<T>, AutoCloseable {
  @Override
  void close();
}
