package com.gentoro.kbo.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the assistant's unchecked exception hierarchy.
 *
 * <p>Each instance carries a {@link KboErrorCode} and an optional context map that is included in
 * {@link ErrorDetails} when the failure is logged.
 */
public class KboException extends RuntimeException {
  private final KboErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public KboException(KboErrorCode code, String message) {
    super(message);
    this.code = code == null ? KboErrorCode.UNKNOWN : code;
  }

  public KboException(KboErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? KboErrorCode.UNKNOWN : code;
  }

  public KboErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value and return this exception for chaining. */
  public KboException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
