package com.hrsynth.api.model;

import java.util.List;

/** One output table: its catalog name, column order and immutable rows. */
public record DataTable<T>(String name, List<String> columns, List<T> rows) {

  public DataTable {
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
  }

  public static <T> DataTable<T> of(TableName table, List<T> rows) {
    return new DataTable<>(table.tableName(), table.columns(), rows);
  }

  public int size() {
    return rows.size();
  }
}
