package com.gentoro.kbo.exception;

/** The model's pseudo-SQL is not a single well-formed, supported SELECT statement. */
public class CompileException extends KboException {
  public CompileException(String message) {
    super(KboErrorCode.COMPILE_ERROR, message);
  }

  public CompileException(String message, Throwable cause) {
    super(KboErrorCode.COMPILE_ERROR, message, cause);
  }
}
