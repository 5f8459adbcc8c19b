/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Built-in {@link ValueCodec}s and lookup by Java type. */
public final class ValueCodecs {
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  public static final ValueCodec<Long> LONG =
      new Base<>(Long.class, "INTEGER", Types.BIGINT, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Long value) throws SQLException {
          statement.setLong(index, value);
        }

        @Override
        Long readValue(ResultSet rows, int index) throws SQLException {
          return rows.getLong(index);
        }
      };

  public static final ValueCodec<Long> LONG_PRIMITIVE =
      new Base<>(long.class, "INTEGER", Types.BIGINT, 0L) {
        @Override
        void bindValue(PreparedStatement statement, int index, Long value) throws SQLException {
          statement.setLong(index, value);
        }

        @Override
        Long readValue(ResultSet rows, int index) throws SQLException {
          return rows.getLong(index);
        }
      };

  public static final ValueCodec<Integer> INT =
      new Base<>(Integer.class, "INTEGER", Types.INTEGER, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Integer value) throws SQLException {
          statement.setInt(index, value);
        }

        @Override
        Integer readValue(ResultSet rows, int index) throws SQLException {
          return rows.getInt(index);
        }
      };

  public static final ValueCodec<Integer> INT_PRIMITIVE =
      new Base<>(int.class, "INTEGER", Types.INTEGER, 0) {
        @Override
        void bindValue(PreparedStatement statement, int index, Integer value) throws SQLException {
          statement.setInt(index, value);
        }

        @Override
        Integer readValue(ResultSet rows, int index) throws SQLException {
          return rows.getInt(index);
        }
      };

  public static final ValueCodec<Short> SHORT =
      new Base<>(Short.class, "INTEGER", Types.SMALLINT, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Short value) throws SQLException {
          statement.setShort(index, value);
        }

        @Override
        Short readValue(ResultSet rows, int index) throws SQLException {
          return rows.getShort(index);
        }
      };

  public static final ValueCodec<Short> SHORT_PRIMITIVE =
      new Base<>(short.class, "INTEGER", Types.SMALLINT, (short) 0) {
        @Override
        void bindValue(PreparedStatement statement, int index, Short value) throws SQLException {
          statement.setShort(index, value);
        }

        @Override
        Short readValue(ResultSet rows, int index) throws SQLException {
          return rows.getShort(index);
        }
      };

  public static final ValueCodec<Byte> BYTE =
      new Base<>(Byte.class, "INTEGER", Types.TINYINT, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Byte value) throws SQLException {
          statement.setByte(index, value);
        }

        @Override
        Byte readValue(ResultSet rows, int index) throws SQLException {
          return rows.getByte(index);
        }
      };

  public static final ValueCodec<Byte> BYTE_PRIMITIVE =
      new Base<>(byte.class, "INTEGER", Types.TINYINT, (byte) 0) {
        @Override
        void bindValue(PreparedStatement statement, int index, Byte value) throws SQLException {
          statement.setByte(index, value);
        }

        @Override
        Byte readValue(ResultSet rows, int index) throws SQLException {
          return rows.getByte(index);
        }
      };

  public static final ValueCodec<Boolean> BOOLEAN =
      new Base<>(Boolean.class, "INTEGER", Types.INTEGER, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Boolean value) throws SQLException {
          statement.setInt(index, value ? 1 : 0);
        }

        @Override
        Boolean readValue(ResultSet rows, int index) throws SQLException {
          return rows.getInt(index) != 0;
        }

        @Override
        String renderLiteral(Boolean value) {
          return value ? "1" : "0";
        }
      };

  public static final ValueCodec<Boolean> BOOLEAN_PRIMITIVE =
      new Base<>(boolean.class, "INTEGER", Types.INTEGER, false) {
        @Override
        void bindValue(PreparedStatement statement, int index, Boolean value) throws SQLException {
          statement.setInt(index, value ? 1 : 0);
        }

        @Override
        Boolean readValue(ResultSet rows, int index) throws SQLException {
          return rows.getInt(index) != 0;
        }

        @Override
        String renderLiteral(Boolean value) {
          return value ? "1" : "0";
        }
      };

  public static final ValueCodec<Double> DOUBLE =
      new Base<>(Double.class, "REAL", Types.DOUBLE, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Double value) throws SQLException {
          statement.setDouble(index, value);
        }

        @Override
        Double readValue(ResultSet rows, int index) throws SQLException {
          return rows.getDouble(index);
        }
      };

  public static final ValueCodec<Double> DOUBLE_PRIMITIVE =
      new Base<>(double.class, "REAL", Types.DOUBLE, 0.0d) {
        @Override
        void bindValue(PreparedStatement statement, int index, Double value) throws SQLException {
          statement.setDouble(index, value);
        }

        @Override
        Double readValue(ResultSet rows, int index) throws SQLException {
          return rows.getDouble(index);
        }
      };

  public static final ValueCodec<Float> FLOAT =
      new Base<>(Float.class, "REAL", Types.FLOAT, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, Float value) throws SQLException {
          statement.setFloat(index, value);
        }

        @Override
        Float readValue(ResultSet rows, int index) throws SQLException {
          return rows.getFloat(index);
        }
      };

  public static final ValueCodec<Float> FLOAT_PRIMITIVE =
      new Base<>(float.class, "REAL", Types.FLOAT, 0.0f) {
        @Override
        void bindValue(PreparedStatement statement, int index, Float value) throws SQLException {
          statement.setFloat(index, value);
        }

        @Override
        Float readValue(ResultSet rows, int index) throws SQLException {
          return rows.getFloat(index);
        }
      };

  public static final ValueCodec<String> STRING =
      new Base<>(String.class, "TEXT", Types.VARCHAR, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, String value) throws SQLException {
          statement.setString(index, value);
        }

        @Override
        String readValue(ResultSet rows, int index) throws SQLException {
          return rows.getString(index);
        }

        @Override
        String renderLiteral(String value) {
          return quote(value);
        }
      };

  public static final ValueCodec<byte[]> BLOB =
      new Base<>(byte[].class, "BLOB", Types.BLOB, null) {
        @Override
        void bindValue(PreparedStatement statement, int index, byte[] value) throws SQLException {
          statement.setBytes(index, value);
        }

        @Override
        byte[] readValue(ResultSet rows, int index) throws SQLException {
          return rows.getBytes(index);
        }

        @Override
        String renderLiteral(byte[] value) {
          return "X'" + hex(value) + "'";
        }

        @Override
        public String print(byte[] value) {
          return value == null ? "null" : hex(value);
        }
      };

  private static final Map<Class<?>, ValueCodec<?>> BUILT_IN =
      Map.ofEntries(
          Map.entry(Long.class, LONG),
          Map.entry(long.class, LONG_PRIMITIVE),
          Map.entry(Integer.class, INT),
          Map.entry(int.class, INT_PRIMITIVE),
          Map.entry(Short.class, SHORT),
          Map.entry(short.class, SHORT_PRIMITIVE),
          Map.entry(Byte.class, BYTE),
          Map.entry(byte.class, BYTE_PRIMITIVE),
          Map.entry(Boolean.class, BOOLEAN),
          Map.entry(boolean.class, BOOLEAN_PRIMITIVE),
          Map.entry(Double.class, DOUBLE),
          Map.entry(double.class, DOUBLE_PRIMITIVE),
          Map.entry(Float.class, FLOAT),
          Map.entry(float.class, FLOAT_PRIMITIVE),
          Map.entry(String.class, STRING),
          Map.entry(byte[].class, BLOB));

  private ValueCodecs() {}

  /**
   * Looks up the codec for a Java type. Enums are stored as their constant name.
   *
   * @param type Java value type
   * @return codec, or empty if the type is not supported
   */
  @SuppressWarnings("unchecked")
  public static <F> Optional<ValueCodec<F>> find(Class<F> type) {
    if (type == null) {
      return Optional.empty();
    }
    ValueCodec<?> codec = BUILT_IN.get(type);
    if (codec != null) {
      return Optional.of((ValueCodec<F>) codec);
    }
    if (type.isEnum()) {
      return Optional.of(new EnumCodec<>(type));
    }
    return Optional.empty();
  }

  /**
   * Looks up the codec for a Java type.
   *
   * @param type Java value type
   * @return codec
   * @throws IllegalArgumentException if the type is not supported
   */
  public static <F> ValueCodec<F> forType(Class<F> type) {
    return find(type)
        .orElseThrow(
            () -> new IllegalArgumentException("no value codec for type " + type.getName()));
  }

  /**
   * Returns the reference-typed counterpart of a primitive codec so SQL {@code NULL} survives
   * reading, as aggregate results over empty sets require.
   *
   * @param codec any codec
   * @return codec that reads {@code NULL} as {@code null}
   */
  @SuppressWarnings("unchecked")
  public static <F> ValueCodec<F> nullable(ValueCodec<F> codec) {
    if (!codec.primitive()) {
      return codec;
    }
    Class<?> boxed = box(codec.javaType());
    return (ValueCodec<F>) BUILT_IN.get(boxed);
  }

  static String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  static String hex(byte[] value) {
    char[] out = new char[value.length * 2];
    for (int i = 0; i < value.length; i++) {
      int b = value[i] & 0xFF;
      out[i * 2] = HEX[b >>> 4];
      out[i * 2 + 1] = HEX[b & 0x0F];
    }
    return new String(out);
  }

  private static Class<?> box(Class<?> primitive) {
    if (primitive == long.class) {
      return Long.class;
    }
    if (primitive == int.class) {
      return Integer.class;
    }
    if (primitive == short.class) {
      return Short.class;
    }
    if (primitive == byte.class) {
      return Byte.class;
    }
    if (primitive == boolean.class) {
      return Boolean.class;
    }
    if (primitive == double.class) {
      return Double.class;
    }
    if (primitive == float.class) {
      return Float.class;
    }
    throw new IllegalArgumentException("not a supported primitive: " + primitive);
  }

  /** Shared null handling; subclasses only see non-null values. */
  abstract static class Base<F> implements ValueCodec<F> {
    private final Class<F> javaType;
    private final String sqlType;
    private final int jdbcType;
    private final F nullValue;

    @SuppressWarnings("unchecked")
    Base(Class<?> javaType, String sqlType, int jdbcType, F nullValue) {
      this.javaType = (Class<F>) javaType;
      this.sqlType = sqlType;
      this.jdbcType = jdbcType;
      this.nullValue = nullValue;
    }

    abstract void bindValue(PreparedStatement statement, int index, F value) throws SQLException;

    abstract F readValue(ResultSet rows, int index) throws SQLException;

    String renderLiteral(F value) {
      return String.valueOf(value);
    }

    @Override
    public final String sqlType() {
      return sqlType;
    }

    @Override
    public final Class<F> javaType() {
      return javaType;
    }

    @Override
    public final void bind(PreparedStatement statement, int index, F value) throws SQLException {
      if (value == null) {
        statement.setNull(index, jdbcType);
      } else {
        bindValue(statement, index, value);
      }
    }

    @Override
    public final F read(ResultSet rows, int index) throws SQLException {
      F value = readValue(rows, index);
      return rows.wasNull() ? nullValue : value;
    }

    @Override
    public final String literal(F value) {
      return value == null ? "NULL" : renderLiteral(value);
    }
  }

  /** Stores constants by {@link Enum#name()}; {@code F} is always an enum type. */
  private static final class EnumCodec<F> extends Base<F> {
    private final Class<F> enumType;
    private final Map<String, F> byName = new HashMap<>();

    EnumCodec(Class<F> enumType) {
      super(enumType, "TEXT", Types.VARCHAR, null);
      this.enumType = enumType;
      for (F constant : enumType.getEnumConstants()) {
        byName.put(nameOf(constant), constant);
      }
    }

    private static String nameOf(Object constant) {
      return ((Enum<?>) constant).name();
    }

    @Override
    void bindValue(PreparedStatement statement, int index, F value) throws SQLException {
      statement.setString(index, nameOf(value));
    }

    @Override
    F readValue(ResultSet rows, int index) throws SQLException {
      String name = rows.getString(index);
      if (name == null) {
        return null;
      }
      F constant = byName.get(name);
      if (constant == null) {
        throw new SQLException("unknown " + enumType.getSimpleName() + " constant '" + name + "'");
      }
      return constant;
    }

    @Override
    String renderLiteral(F value) {
      return quote(nameOf(value));
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof EnumCodec<?> codec && codec.enumType == enumType;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(enumType);
    }
  }
}
