package com.gentoro.kbo.exception;

/** Errors raised by a language model provider. */
public class LlmException extends KboException {
  public LlmException(String message) {
    super(KboErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(KboErrorCode.LLM_ERROR, message, cause);
  }
}
