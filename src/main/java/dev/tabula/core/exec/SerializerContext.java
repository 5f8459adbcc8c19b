/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

/**
 * Rendering switches for {@link SqlSerializer}.
 *
 * @param skipTableName render columns without the {@code "table".} qualifier
 * @param replaceBindableWithQuestion render constants as {@code ?} and collect parameter slots;
 *     when off, constants are inlined as SQL literals
 */
public record SerializerContext(boolean skipTableName, boolean replaceBindableWithQuestion) {

  public static final SerializerContext PARAMETRIZED = new SerializerContext(false, true);
  public static final SerializerContext INLINE = new SerializerContext(false, false);
}
