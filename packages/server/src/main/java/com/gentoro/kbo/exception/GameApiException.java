package com.gentoro.kbo.exception;

/** Failures calling the game record and preview endpoints. */
public class GameApiException extends KboException {
  public GameApiException(String message) {
    super(KboErrorCode.GAME_API_ERROR, message);
  }

  public GameApiException(String message, Throwable cause) {
    super(KboErrorCode.GAME_API_ERROR, message, cause);
  }
}
