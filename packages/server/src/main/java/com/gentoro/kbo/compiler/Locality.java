package com.gentoro.kbo.compiler;

/** Where sort and limit run. */
public enum Locality {
  /** The store orders and truncates. */
  SERVER,
  /** Rows are fetched unsorted, filtered, then sorted and sliced here. */
  CLIENT
}
