/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/** Factories for {@link FieldAccessor}s. */
public final class Accessors {

  private Accessors() {}

  /**
   * Accessor backed by a getter and a setter.
   *
   * @param getter reads the value
   * @param setter writes the value
   * @return accessor
   */
  public static <T, F> FieldAccessor<T, F> of(Function<T, F> getter, BiConsumer<T, F> setter) {
    Objects.requireNonNull(getter, "getter");
    Objects.requireNonNull(setter, "setter");
    return new FieldAccessor<>() {
      @Override
      public F read(T object) {
        return getter.apply(object);
      }

      @Override
      public void write(T object, F value) {
        setter.accept(object, value);
      }
    };
  }

  /**
   * Accessor backed by a direct handle on a declared instance field (private fields allowed).
   *
   * @param owner class declaring the field
   * @param fieldName field name
   * @param type field type, exactly as declared
   * @return accessor
   * @throws IllegalArgumentException if the field does not exist or has another type
   */
  public static <T, F> FieldAccessor<T, F> field(Class<T> owner, String fieldName, Class<F> type) {
    Objects.requireNonNull(owner, "owner");
    Objects.requireNonNull(fieldName, "fieldName");
    Objects.requireNonNull(type, "type");
    VarHandle handle;
    try {
      MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(owner, MethodHandles.lookup());
      handle = lookup.findVarHandle(owner, fieldName, type);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new IllegalArgumentException(
          "cannot access field " + owner.getSimpleName() + "." + fieldName, e);
    }
    return new DirectField<>(handle);
  }

  private static final class DirectField<T, F> implements FieldAccessor<T, F> {
    private final VarHandle handle;

    private DirectField(VarHandle handle) {
      this.handle = handle;
    }

    @Override
    @SuppressWarnings("unchecked")
    public F read(T object) {
      return (F) handle.get(object);
    }

    @Override
    public void write(T object, F value) {
      handle.set(object, value);
    }
  }
}
