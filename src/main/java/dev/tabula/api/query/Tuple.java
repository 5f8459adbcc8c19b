/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One row of a multi-expression select, values in select-list order. Values may be null. */
public final class Tuple {
  private final List<Object> values;

  public Tuple(List<?> values) {
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  public <V> V get(int index, Class<V> type) {
    return type.cast(values.get(index));
  }

  public List<Object> values() {
    return values;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Tuple tuple && values.equals(tuple.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Tuple" + values;
  }
}
