/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import dev.tabula.api.ErrorCode;
import dev.tabula.api.StorageException;
import dev.tabula.api.query.Assignment;
import dev.tabula.api.query.Clause;
import dev.tabula.api.query.Condition;
import dev.tabula.api.query.Expression;
import dev.tabula.api.query.FunctionCall;
import dev.tabula.api.query.Statement;
import dev.tabula.api.query.Value;
import dev.tabula.api.schema.Column;
import dev.tabula.api.schema.Schema;
import dev.tabula.api.schema.Table;
import dev.tabula.api.schema.ValueCodecs;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders {@link Statement} descriptions to SQL text in a single pass.
 *
 * <p>Each {@code ?} is written together with its {@link ParameterSlot}, so slot order always equals
 * placeholder order. Columns are resolved against the {@link Schema}; a column that is not
 * registered raises {@link ErrorCode#COLUMN_NOT_FOUND}.
 */
public final class SqlSerializer {
  private final Schema schema;

  public SqlSerializer(Schema schema) {
    this.schema = schema;
  }

  /**
   * Compiles a statement.
   *
   * @param statement statement description
   * @param context rendering switches
   * @return SQL text with its parameter slots (empty when constants are inlined)
   */
  public CompiledSql compile(Statement<?> statement, SerializerContext context) {
    Writer w = new Writer(context);
    if (statement instanceof Statement.Get<?> get) {
      writeGet(w, get);
    } else if (statement instanceof Statement.GetAll<?> getAll) {
      writeGetAll(w, getAll);
    } else if (statement instanceof Statement.Select<?> select) {
      writeSelect(w, List.of(select.expression()), null, select.clauses());
    } else if (statement instanceof Statement.SelectTuples select) {
      writeSelect(w, select.expressions(), null, select.clauses());
    } else if (statement instanceof Statement.SelectValue<?> select) {
      writeSelect(w, List.of(select.expression()), select.from(), select.clauses());
    } else if (statement instanceof Statement.Insert<?> insert) {
      writeInsert(w, insert);
    } else if (statement instanceof Statement.InsertColumns<?> insert) {
      writeInsertColumns(w, insert);
    } else if (statement instanceof Statement.InsertRange<?> range) {
      writeInsertRange(w, range);
    } else if (statement instanceof Statement.Replace<?> replace) {
      writeReplace(w, replace);
    } else if (statement instanceof Statement.Update<?> update) {
      writeUpdate(w, update);
    } else if (statement instanceof Statement.UpdateAll updateAll) {
      writeUpdateAll(w, updateAll);
    } else if (statement instanceof Statement.Remove<?> remove) {
      writeRemove(w, remove);
    } else if (statement instanceof Statement.RemoveAll<?> removeAll) {
      writeRemoveAll(w, removeAll);
    } else {
      throw new IllegalArgumentException(
          "unsupported statement " + (statement == null ? null : statement.getClass().getName()));
    }
    return new CompiledSql(w.sql.toString(), w.slots);
  }

  private <T> void writeGet(Writer w, Statement.Get<T> get) {
    Table<T> table = schema.table(get.type());
    List<Column<T, ?>> key = requireKey(table, get.ids().size());
    w.append("SELECT ");
    writeSelectList(w, table);
    w.append(" FROM ").append(Identifiers.quote(table.name())).append(" WHERE ");
    List<ParameterSlot> slots = new ArrayList<>(key.size());
    for (int i = 0; i < key.size(); i++) {
      slots.add(ParameterSlot.constant(get.ids().get(i), key.get(i).codec()));
    }
    writeKeyMatch(w, key, slots);
  }

  private <T> void writeGetAll(Writer w, Statement.GetAll<T> getAll) {
    Table<T> table = schema.table(getAll.type());
    w.append("SELECT ");
    writeSelectList(w, table);
    w.append(" FROM ").append(Identifiers.quote(table.name()));
    writeClauses(w, getAll.clauses(), true);
  }

  private void writeSelect(
      Writer w, List<? extends Expression<?>> expressions, Class<?> from, List<Clause> clauses) {
    Set<Table<?>> tables = new LinkedHashSet<>();
    if (from != null) {
      tables.add(schema.table(from));
    }
    for (Expression<?> expression : expressions) {
      collect(expression, tables);
    }
    for (Clause clause : clauses) {
      collect(clause, tables);
    }
    w.append("SELECT ");
    for (int i = 0; i < expressions.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.expression(expressions.get(i));
    }
    if (!tables.isEmpty()) {
      w.append(" FROM ");
      boolean first = true;
      for (Table<?> table : tables) {
        if (!first) {
          w.append(", ");
        }
        w.append(Identifiers.quote(table.name()));
        first = false;
      }
    }
    writeClauses(w, clauses, true);
  }

  private <T> void writeInsert(Writer w, Statement.Insert<T> insert) {
    Table<T> table = schema.table(insert.type());
    requireInsertable(table);
    List<Column<T, ?>> columns = table.insertColumns();
    w.append("INSERT INTO ").append(Identifiers.quote(table.name()));
    if (columns.isEmpty()) {
      w.append(" DEFAULT VALUES");
      return;
    }
    writeNameList(w, columns);
    w.append(" VALUES ");
    writeValueRow(w, insert.object(), columns);
  }

  private <T> void writeInsertColumns(Writer w, Statement.InsertColumns<T> insert) {
    Table<T> table = schema.table(insert.type());
    for (Column<T, ?> column : insert.columns()) {
      if (!table.owns(column)) {
        throw new StorageException(
            ErrorCode.COLUMN_NOT_FOUND,
            "column " + column.name() + " is not registered in " + table.name());
      }
      if (column.isGenerated()) {
        throw new StorageException(
            ErrorCode.INVALID_SCHEMA, "generated column " + column.name() + " cannot be inserted");
      }
    }
    w.append("INSERT INTO ").append(Identifiers.quote(table.name()));
    writeNameList(w, insert.columns());
    w.append(" VALUES ");
    writeValueRow(w, insert.object(), insert.columns());
  }

  private <T> void writeInsertRange(Writer w, Statement.InsertRange<T> range) {
    Table<T> table = schema.table(range.type());
    if (range.objects().isEmpty()) {
      throw new IllegalArgumentException("cannot compile an empty range for " + table.name());
    }
    if (!range.replace()) {
      requireInsertable(table);
    }
    List<Column<T, ?>> columns = range.replace() ? table.writableColumns() : table.insertColumns();
    if (columns.isEmpty()) {
      throw new StorageException(
          ErrorCode.INVALID_SCHEMA, "table " + table.name() + " has no columns to insert");
    }
    w.append(range.replace() ? "REPLACE INTO " : "INSERT INTO ")
        .append(Identifiers.quote(table.name()));
    writeNameList(w, columns);
    w.append(" VALUES ");
    for (int i = 0; i < range.objects().size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      writeValueRow(w, range.objects().get(i), columns);
    }
  }

  private <T> void writeReplace(Writer w, Statement.Replace<T> replace) {
    Table<T> table = schema.table(replace.type());
    List<Column<T, ?>> columns = table.writableColumns();
    w.append("REPLACE INTO ").append(Identifiers.quote(table.name()));
    writeNameList(w, columns);
    w.append(" VALUES ");
    writeValueRow(w, replace.object(), columns);
  }

  private <T> void writeUpdate(Writer w, Statement.Update<T> update) {
    Table<T> table = schema.table(update.type());
    List<Column<T, ?>> key = requireKey(table, -1);
    List<Column<T, ?>> columns = table.updateColumns();
    if (columns.isEmpty()) {
      throw new StorageException(
          ErrorCode.INVALID_SCHEMA, "table " + table.name() + " has no non-key columns to update");
    }
    w.append("UPDATE ").append(Identifiers.quote(table.name())).append(" SET ");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.append(Identifiers.quote(columns.get(i).name())).append(" = ");
      w.bindable(ParameterSlot.field(update.object(), columns.get(i)));
    }
    w.append(" WHERE ");
    List<ParameterSlot> slots = new ArrayList<>(key.size());
    for (Column<T, ?> column : key) {
      slots.add(ParameterSlot.field(update.object(), column));
    }
    writeKeyMatch(w, key, slots);
  }

  private void writeUpdateAll(Writer w, Statement.UpdateAll updateAll) {
    Table<?> table = null;
    for (Assignment<?> assignment : updateAll.assignments()) {
      Table<?> owner = tableOf(assignment.column());
      if (table != null && table != owner) {
        throw new IllegalArgumentException("update assignments span several tables");
      }
      table = owner;
    }
    w.append("UPDATE ").append(Identifiers.quote(table.name())).append(" SET ");
    for (int i = 0; i < updateAll.assignments().size(); i++) {
      Assignment<?> assignment = updateAll.assignments().get(i);
      if (i > 0) {
        w.append(", ");
      }
      w.append(Identifiers.quote(assignment.column().name())).append(" = ");
      w.expression(assignment.value());
    }
    writeClauses(w, updateAll.clauses(), false);
  }

  private <T> void writeRemove(Writer w, Statement.Remove<T> remove) {
    Table<T> table = schema.table(remove.type());
    List<Column<T, ?>> key = requireKey(table, remove.ids().size());
    w.append("DELETE FROM ").append(Identifiers.quote(table.name())).append(" WHERE ");
    List<ParameterSlot> slots = new ArrayList<>(key.size());
    for (int i = 0; i < key.size(); i++) {
      slots.add(ParameterSlot.constant(remove.ids().get(i), key.get(i).codec()));
    }
    writeKeyMatch(w, key, slots);
  }

  private <T> void writeRemoveAll(Writer w, Statement.RemoveAll<T> removeAll) {
    Table<T> table = schema.table(removeAll.type());
    w.append("DELETE FROM ").append(Identifiers.quote(table.name()));
    writeClauses(w, removeAll.clauses(), false);
  }

  private <T> void writeSelectList(Writer w, Table<T> table) {
    List<Column<T, ?>> columns = table.columns();
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.column(columns.get(i));
    }
  }

  private static <T> void writeNameList(Writer w, List<Column<T, ?>> columns) {
    w.append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.append(Identifiers.quote(columns.get(i).name()));
    }
    w.append(")");
  }

  private static <T> void writeValueRow(Writer w, T object, List<Column<T, ?>> columns) {
    w.append("(");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        w.append(", ");
      }
      w.bindable(ParameterSlot.field(object, columns.get(i)));
    }
    w.append(")");
  }

  private static <T> void writeKeyMatch(
      Writer w, List<Column<T, ?>> key, List<ParameterSlot> values) {
    for (int i = 0; i < key.size(); i++) {
      if (i > 0) {
        w.append(" AND ");
      }
      w.column(key.get(i));
      w.append(" = ");
      w.bindable(values.get(i));
    }
  }

  private void writeClauses(Writer w, List<Clause> clauses, boolean selectClausesAllowed) {
    Clause.Where where = null;
    Clause.GroupBy groupBy = null;
    Clause.Limit limit = null;
    List<Clause.OrderBy> orderBy = new ArrayList<>();
    for (Clause clause : clauses) {
      if (clause instanceof Clause.Where candidate) {
        if (where != null) {
          throw new IllegalArgumentException("more than one WHERE clause; combine with and()");
        }
        where = candidate;
        continue;
      }
      if (!selectClausesAllowed) {
        throw new IllegalArgumentException(
            "only WHERE is supported here, got " + clause.getClass().getSimpleName());
      }
      if (clause instanceof Clause.GroupBy candidate) {
        if (groupBy != null) {
          throw new IllegalArgumentException("more than one GROUP BY clause");
        }
        groupBy = candidate;
      } else if (clause instanceof Clause.Limit candidate) {
        if (limit != null) {
          throw new IllegalArgumentException("more than one LIMIT clause");
        }
        limit = candidate;
      } else if (clause instanceof Clause.OrderBy candidate) {
        orderBy.add(candidate);
      } else {
        throw new IllegalArgumentException("unsupported clause " + clause);
      }
    }
    if (where != null) {
      w.append(" WHERE ");
      w.condition(where.condition());
    }
    if (groupBy != null) {
      w.append(" GROUP BY ");
      for (int i = 0; i < groupBy.expressions().size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.expression(groupBy.expressions().get(i));
      }
      if (groupBy.having() != null) {
        w.append(" HAVING ");
        w.condition(groupBy.having());
      }
    }
    if (!orderBy.isEmpty()) {
      w.append(" ORDER BY ");
      for (int i = 0; i < orderBy.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.expression(orderBy.get(i).expression());
        if (orderBy.get(i).descending()) {
          w.append(" DESC");
        }
      }
    }
    if (limit != null) {
      w.append(" LIMIT ");
      w.bindable(ParameterSlot.constant(limit.count(), ValueCodecs.LONG));
      if (limit.offset() != null) {
        w.append(" OFFSET ");
        w.bindable(ParameterSlot.constant(limit.offset(), ValueCodecs.LONG));
      }
    }
  }

  private void collect(Object node, Set<Table<?>> tables) {
    if (node instanceof Column<?, ?> column) {
      tables.add(tableOf(column));
    } else if (node instanceof FunctionCall<?> call) {
      for (Expression<?> argument : call.arguments()) {
        collect(argument, tables);
      }
    } else if (node instanceof Condition.Binary binary) {
      collect(binary.left(), tables);
      collect(binary.right(), tables);
    } else if (node instanceof Condition.In in) {
      collect(in.left(), tables);
      for (Expression<?> value : in.values()) {
        collect(value, tables);
      }
    } else if (node instanceof Condition.NullCheck check) {
      collect(check.operand(), tables);
    } else if (node instanceof Condition.Not not) {
      collect(not.inner(), tables);
    } else if (node instanceof Condition.Logical logical) {
      collect(logical.left(), tables);
      collect(logical.right(), tables);
    } else if (node instanceof Clause.Where where) {
      collect(where.condition(), tables);
    } else if (node instanceof Clause.OrderBy orderBy) {
      collect(orderBy.expression(), tables);
    } else if (node instanceof Clause.GroupBy groupBy) {
      for (Expression<?> expression : groupBy.expressions()) {
        collect(expression, tables);
      }
      if (groupBy.having() != null) {
        collect(groupBy.having(), tables);
      }
    }
  }

  private Table<?> tableOf(Column<?, ?> column) {
    return schema
        .tableOf(column)
        .orElseThrow(
            () ->
                new StorageException(
                    ErrorCode.COLUMN_NOT_FOUND,
                    "column " + column.name() + " is not registered in the schema"));
  }

  private static <T> List<Column<T, ?>> requireKey(Table<T> table, int idCount) {
    List<Column<T, ?>> key = table.primaryKey();
    if (key.isEmpty()) {
      throw new StorageException(
          ErrorCode.INVALID_SCHEMA, "table " + table.name() + " has no primary key");
    }
    if (idCount >= 0 && idCount != key.size()) {
      throw new IllegalArgumentException(
          "table " + table.name() + " expects " + key.size() + " key value(s), got " + idCount);
    }
    return key;
  }

  private static void requireInsertable(Table<?> table) {
    table
        .insertRestriction()
        .ifPresent(
            reason -> {
              throw new StorageException(ErrorCode.INVALID_SCHEMA, reason);
            });
  }

  /** Accumulates text and slots for one compilation. */
  private final class Writer {
    private final SerializerContext context;
    private final StringBuilder sql = new StringBuilder(128);
    private final List<ParameterSlot> slots = new ArrayList<>();

    private Writer(SerializerContext context) {
      this.context = context;
    }

    private Writer append(String text) {
      sql.append(text);
      return this;
    }

    private void column(Column<?, ?> column) {
      Table<?> table = tableOf(column);
      if (!context.skipTableName()) {
        sql.append(Identifiers.quote(table.name())).append('.');
      }
      sql.append(Identifiers.quote(column.name()));
    }

    private void bindable(ParameterSlot slot) {
      if (context.replaceBindableWithQuestion()) {
        sql.append('?');
        slots.add(slot);
      } else {
        sql.append(slot.literal());
      }
    }

    private void expression(Expression<?> expression) {
      if (expression instanceof Column<?, ?> column) {
        column(column);
      } else if (expression instanceof Value<?> value) {
        bindable(ParameterSlot.constant(value.value(), value.codec()));
      } else if (expression instanceof FunctionCall<?> call) {
        sql.append(call.name()).append('(');
        if (call.star()) {
          sql.append('*');
        } else {
          for (int i = 0; i < call.arguments().size(); i++) {
            if (i > 0) {
              sql.append(", ");
            }
            expression(call.arguments().get(i));
          }
        }
        sql.append(')');
      } else {
        throw new IllegalArgumentException("unsupported expression " + expression);
      }
    }

    private void condition(Condition condition) {
      if (condition instanceof Condition.Binary binary) {
        expression(binary.left());
        sql.append(' ').append(binary.operator()).append(' ');
        expression(binary.right());
      } else if (condition instanceof Condition.In in) {
        expression(in.left());
        sql.append(in.negated() ? " NOT IN (" : " IN (");
        for (int i = 0; i < in.values().size(); i++) {
          if (i > 0) {
            sql.append(", ");
          }
          expression(in.values().get(i));
        }
        sql.append(')');
      } else if (condition instanceof Condition.NullCheck check) {
        expression(check.operand());
        sql.append(check.negated() ? " IS NOT NULL" : " IS NULL");
      } else if (condition instanceof Condition.Not not) {
        sql.append("NOT (");
        condition(not.inner());
        sql.append(')');
      } else if (condition instanceof Condition.Logical logical) {
        sql.append('(');
        condition(logical.left());
        sql.append(") ").append(logical.operator()).append(" (");
        condition(logical.right());
        sql.append(')');
      } else {
        throw new IllegalArgumentException("unsupported condition " + condition);
      }
    }
  }
}
