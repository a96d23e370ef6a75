package com.gentoro.kbo.exception;

/** Stable error codes attached to every {@link KboException}. */
public enum KboErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  COMPILE_ERROR,
  UNSUPPORTED_TABLE,
  STORE_ERROR,
  GAME_API_ERROR,
  LLM_ERROR,
  IO_ERROR
}
