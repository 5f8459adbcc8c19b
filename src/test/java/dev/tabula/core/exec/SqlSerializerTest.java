/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import static dev.tabula.api.query.Clauses.limit;
import static dev.tabula.api.query.Clauses.orderBy;
import static dev.tabula.api.query.Clauses.where;
import static dev.tabula.api.query.Conditions.and;
import static dev.tabula.api.query.Conditions.eq;
import static dev.tabula.api.query.Conditions.gt;
import static dev.tabula.api.query.Conditions.in;
import static dev.tabula.api.query.Conditions.isNull;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import dev.tabula.api.query.Aggregates;
import dev.tabula.api.query.Assignment;
import dev.tabula.api.query.Statement;
import dev.tabula.api.query.Statements;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class SqlSerializerTest {
  static final class Item {
    long id;
    String name;
    Integer qty;
  }

  static final class Tag {
    String code;
  }

  private final Column<Item, Long> id =
      Column.of("id", long.class, (Item i) -> i.id, (i, v) -> i.id = v).primaryKey();
  private final Column<Item, String> name =
      Column.of("name", String.class, (Item i) -> i.name, (i, v) -> i.name = v).notNull();
  private final Column<Item, Integer> qty =
      Column.of("qty", Integer.class, (Item i) -> i.qty, (i, v) -> i.qty = v);
  private final Column<Tag, String> code =
      Column.of("code", String.class, (Tag t) -> t.code, (t, v) -> t.code = v).primaryKey();

  private final SqlSerializer serializer =
      new SqlSerializer(
          Schema.builder()
              .table(
                  Table.builder("items", Item.class, Item::new)
                      .column(id)
                      .column(name)
                      .column(qty)
                      .build())
              .table(Table.builder("tags", Tag.class, Tag::new).column(code).build())
              .build());

  private CompiledSql compile(Statement<?> statement) {
    return serializer.compile(statement, SerializerContext.PARAMETRIZED);
  }

  private static long placeholders(String sql) {
    return sql.chars().filter(ch -> ch == '?').count();
  }

  private static Item item(long id, String name, Integer qty) {
    Item item = new Item();
    item.id = id;
    item.name = name;
    item.qty = qty;
    return item;
  }

  @Test
  void updateBindsSetColumnsThenKey() throws SQLException {
    CompiledSql compiled = compile(Statements.update(item(9, "box", 3)));

    assertEquals(
        "UPDATE \"items\" SET \"name\" = ?, \"qty\" = ? WHERE \"items\".\"id\" = ?",
        compiled.sql());
    PreparedStatement ps = mock(PreparedStatement.class);
    for (int i = 0; i < compiled.slots().size(); i++) {
      compiled.slots().get(i).bind(ps, i + 1);
    }
    InOrder order = inOrder(ps);
    order.verify(ps).setString(1, "box");
    order.verify(ps).setInt(2, 3);
    order.verify(ps).setLong(3, 9L);
  }

  @Test
  void nullFieldBindsSqlNull() throws SQLException {
    CompiledSql compiled = compile(Statements.replace(item(1, "box", null)));
    PreparedStatement ps = mock(PreparedStatement.class);

    compiled.slots().get(2).bind(ps, 3);

    inOrder(ps).verify(ps).setNull(3, Types.INTEGER);
  }

  @Test
  void clausesRenderInSqlOrderWhateverTheArgumentOrder() {
    CompiledSql compiled =
        compile(
            Statements.getAll(
                Item.class, limit(10, 20), orderBy(name).desc(), where(gt(qty, 1)), orderBy(id)));

    assertEquals(
        "SELECT \"items\".\"id\", \"items\".\"name\", \"items\".\"qty\" FROM \"items\""
            + " WHERE \"items\".\"qty\" > ? ORDER BY \"items\".\"name\" DESC, \"items\".\"id\""
            + " LIMIT ? OFFSET ?",
        compiled.sql());
    assertEquals(List.of(1, 10L, 20L), compiled.slots().stream().map(ParameterSlot::value).toList());
  }

  @Test
  void placeholderCountMatchesSlots() {
    List<Statement<?>> statements =
        List.of(
            Statements.get(Item.class, 4),
            Statements.insert(item(0, "a", 1)),
            Statements.insertRange(Item.class, List.of(item(0, "a", 1), item(0, "b", null))),
            Statements.remove(Item.class, 4L),
            Statements.removeAll(
                Item.class, where(and(in(id, List.of(1L, 2L, 3L)), isNull(qty)))),
            Statements.updateAll(List.of(Assignment.set(qty, 0)), where(eq(name, "x"))),
            Statements.value(Aggregates.count(), Item.class, where(gt(qty, 5))));

    for (Statement<?> statement : statements) {
      CompiledSql compiled = compile(statement);
      assertEquals(placeholders(compiled.sql()), compiled.slots().size(), compiled.sql());
    }
  }

  @Test
  void fieldSlotsReadTheObjectAtBindTime() {
    Item draft = item(0, "first", 1);
    CompiledSql compiled = compile(Statements.insert(draft));

    draft.name = "second";

    assertEquals("INSERT INTO \"items\" (\"name\", \"qty\") VALUES (?, ?)", compiled.sql());
    assertEquals("second", compiled.slots().get(0).value());
  }

  @Test
  void inlineRenderingQuotesLiterals() {
    CompiledSql compiled =
        serializer.compile(
            Statements.select(name, where(eq(name, "it's"))), SerializerContext.INLINE);

    assertEquals(
        "SELECT \"items\".\"name\" FROM \"items\" WHERE \"items\".\"name\" = 'it''s'",
        compiled.sql());
    assertTrue(compiled.slots().isEmpty());
  }

  @Test
  void selectListsEveryReferencedTable() {
    CompiledSql compiled = compile(Statements.select(List.of(name, code)));

    assertEquals(
        "SELECT \"items\".\"name\", \"tags\".\"code\" FROM \"items\", \"tags\"", compiled.sql());
  }

  @Test
  void unregisteredColumnIsRejected() {
    Column<Item, String> stray =
        Column.of("name", String.class, (Item i) -> i.name, (i, v) -> i.name = v);

    StorageException e =
        assertThrows(StorageException.class, () -> compile(Statements.select(stray)));
    assertEquals(ErrorCode.COLUMN_NOT_FOUND, e.errorCode());
  }

  @Test
  void plainInsertIntoTextKeyedTableIsRejected() {
    Tag tag = new Tag();
    tag.code = "x";

    StorageException e =
        assertThrows(StorageException.class, () -> compile(Statements.insert(tag)));
    assertEquals(ErrorCode.INVALID_SCHEMA, e.errorCode());
  }

  @Test
  void secondWhereIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> compile(Statements.getAll(Item.class, where(gt(qty, 1)), where(gt(qty, 2)))));
  }

  @Test
  void keyArityIsChecked() {
    assertThrows(IllegalArgumentException.class, () -> compile(Statements.get(Item.class, 1, 2)));
  }
}
