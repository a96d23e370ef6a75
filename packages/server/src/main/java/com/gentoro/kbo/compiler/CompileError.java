package com.gentoro.kbo.compiler;

/** Why a pseudo-SQL text was rejected, together with the text itself. */
public record CompileError(String reason, String text) {
  @Override
  public String toString() {
    return reason;
  }
}
