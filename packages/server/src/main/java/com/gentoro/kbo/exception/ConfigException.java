package com.gentoro.kbo.exception;

/** Invalid or missing configuration. */
public class ConfigException extends KboException {
  public ConfigException(String message) {
    super(KboErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KboErrorCode.CONFIG_ERROR, message, cause);
  }
}
