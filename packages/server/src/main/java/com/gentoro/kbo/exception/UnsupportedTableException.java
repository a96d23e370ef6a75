package com.gentoro.kbo.exception;

/** The pseudo-SQL names a table the remote store does not expose. */
public class UnsupportedTableException extends KboException {
  private final String table;

  public UnsupportedTableException(String table) {
    super(KboErrorCode.UNSUPPORTED_TABLE, "Unsupported table: " + table);
    this.table = table;
  }

  public String getTable() {
    return table;
  }
}
