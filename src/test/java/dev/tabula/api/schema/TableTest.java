/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableTest {
  static final class Row {
    long id;
    String code;
    String label;
    Integer size;
  }

  private final Column<Row, Long> id =
      Column.of("id", long.class, (Row r) -> r.id, (r, v) -> r.id = v);
  private final Column<Row, String> code =
      Column.of("code", String.class, (Row r) -> r.code, (r, v) -> r.code = v);
  private final Column<Row, String> label =
      Column.of("label", String.class, (Row r) -> r.label, (r, v) -> r.label = v);
  private final Column<Row, Integer> size =
      Column.of("size", Integer.class, (Row r) -> r.size, (r, v) -> r.size = v);

  private static void assertInvalid(Runnable build) {
    StorageException e = assertThrows(StorageException.class, build::run);
    assertEquals(ErrorCode.INVALID_SCHEMA, e.errorCode());
  }

  @Test
  void integerKeyIsOmittedFromInsertColumns() {
    Table<Row> table =
        Table.builder("rows", Row.class, Row::new)
            .column(id.primaryKey())
            .column(label)
            .column(size.generatedAlways("length(label)", Generated.VIRTUAL))
            .build();

    assertTrue(table.insertRestriction().isEmpty());
    assertEquals(List.of("label"), table.insertColumns().stream().map(Column::name).toList());
    assertEquals(List.of("id", "label"), table.writableColumns().stream().map(Column::name).toList());
    assertEquals(List.of("label"), table.updateColumns().stream().map(Column::name).toList());
  }

  @Test
  void textKeyWithoutDefaultRestrictsPlainInsert() {
    Table<Row> table =
        Table.builder("rows", Row.class, Row::new).column(code.primaryKey()).column(label).build();

    assertTrue(table.insertRestriction().isPresent());
  }

  @Test
  void compositeKeyRestrictsPlainInsertUnlessWithoutRowid() {
    Table<Row> rowid =
        Table.builder("rows", Row.class, Row::new)
            .column(code)
            .column(label)
            .primaryKey(code, label)
            .build();
    Table<Row> withoutRowid =
        Table.builder("rows", Row.class, Row::new)
            .column(code)
            .column(label)
            .primaryKey(code, label)
            .withoutRowid()
            .build();

    assertTrue(rowid.hasCompositeKey());
    assertTrue(rowid.insertRestriction().isPresent());
    assertTrue(withoutRowid.insertRestriction().isEmpty());
    assertEquals(List.of("code", "label"),
        withoutRowid.insertColumns().stream().map(Column::name).toList());
  }

  @Test
  void tableInfoReportsDeclaredShape() {
    Table<Row> table =
        Table.builder("rows", Row.class, Row::new)
            .column(code)
            .column(label.notNull().defaultValue("none"))
            .column(size.generatedAlways("length(label)", Generated.STORED))
            .primaryKey(code)
            .withoutRowid()
            .build();

    List<ColumnInfo> info = table.tableInfo();

    assertEquals(3, info.size());
    assertTrue(info.get(0).notNull(), "WITHOUT ROWID key columns are NOT NULL");
    assertEquals(1, info.get(0).pk());
    assertEquals("'none'", info.get(1).defaultValue());
    assertEquals(3, info.get(2).hidden());
    assertFalse(info.get(2).notNull());
  }

  @Test
  void lookupIsByInstanceAndCaseInsensitiveName() {
    Table<Row> table = Table.builder("rows", Row.class, Row::new).column(label).build();

    assertTrue(table.owns(label));
    assertFalse(table.owns(Column.of("label", String.class, (Row r) -> r.label, (r, v) -> {})));
    assertTrue(table.column("LABEL").isPresent());
  }

  @Test
  void renameChangesOnlyTheModelName() {
    Table<Row> table = Table.builder("rows", Row.class, Row::new).column(label).build();

    table.renameTo("entries");

    assertEquals("entries", table.name());
  }

  @Test
  void inconsistentDeclarationsAreRejected() {
    assertInvalid(() -> Table.builder("rows", Row.class, Row::new).build());
    assertInvalid(
        () -> Table.builder("rows", Row.class, Row::new).column(label).column(label).build());
    assertInvalid(
        () ->
            Table.builder("rows", Row.class, Row::new)
                .column(id.primaryKey())
                .column(code.primaryKey())
                .build());
    assertInvalid(
        () ->
            Table.builder("rows", Row.class, Row::new)
                .column(id.primaryKey())
                .column(code)
                .primaryKey(code)
                .build());
    assertInvalid(
        () -> Table.builder("rows", Row.class, Row::new).column(code.autoincrement()).build());
    assertInvalid(
        () -> Table.builder("rows", Row.class, Row::new).column(label).withoutRowid().build());
    assertInvalid(
        () ->
            Table.builder("rows", Row.class, Row::new)
                .column(label.defaultValue("x").generatedAlways("1", Generated.VIRTUAL))
                .build());
  }
}
