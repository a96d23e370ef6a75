package com.gentoro.kbo.exception;

/** Failures talking to the remote table store. */
public class StoreException extends KboException {
  public StoreException(String message) {
    super(KboErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(KboErrorCode.STORE_ERROR, message, cause);
  }
}
