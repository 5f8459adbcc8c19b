/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

/**
 * Reads and writes one mapped field of an object.
 *
 * <p>Both directions share the value type {@code F}, so a column can never be declared with a
 * getter and setter that disagree. See {@link Accessors} for the built-in variants.
 *
 * @param <T> mapped object type
 * @param <F> field value type
 */
public interface FieldAccessor<T, F> {
  /**
   * Reads the field from {@code object}.
   *
   * @param object mapped instance
   * @return current value
   */
  F read(T object);

  /**
   * Writes {@code value} into {@code object}.
   *
   * @param object mapped instance
   * @param value decoded column value
   */
  void write(T object, F value);
}
