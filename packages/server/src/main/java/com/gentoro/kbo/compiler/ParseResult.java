package com.gentoro.kbo.compiler;

/**
 * Result of parsing model output. The parser never throws; callers test the variant.
 *
 * <pre>{@code
 * if (parser.parse(text) instanceof ParseResult.Ok ok) {
 *   use(ok.query());
 * }
 * }</pre>
 */
public sealed interface ParseResult {

  record Ok(ParsedQuery query) implements ParseResult {}

  record Err(CompileError error) implements ParseResult {}

  static ParseResult ok(ParsedQuery query) {
    return new Ok(query);
  }

  static ParseResult err(String reason, String text) {
    return new Err(new CompileError(reason, text));
  }

  default boolean isOk() {
    return this instanceof Ok;
  }
}
