/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import java.util.List;

/**
 * SQL text plus its parameter slots; slot {@code i} belongs to the {@code i}-th {@code ?}.
 *
 * @param sql compiled text
 * @param slots parameters in placeholder order
 */
public record CompiledSql(String sql, List<ParameterSlot> slots) {

  public CompiledSql {
    slots = List.copyOf(slots);
  }
}
