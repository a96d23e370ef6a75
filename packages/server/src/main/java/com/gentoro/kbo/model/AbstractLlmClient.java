package com.gentoro.kbo.model;

import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.LlmException;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} that bounds every inference by {@code llm.timeout-seconds} and turns
 * provider failures into {@link LlmException}. Subclasses implement {@link #runInference(List)}
 * with a concrete provider SDK.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(AbstractLlmClient.class);

  static final long DEFAULT_TIMEOUT_SECONDS = 60;

  protected final Configuration configuration;
  private final long timeoutSeconds;

  protected AbstractLlmClient(Configuration configuration) {
    this.configuration = configuration;
    this.timeoutSeconds = configuration.getLong("llm.timeout-seconds", DEFAULT_TIMEOUT_SECONDS);
  }

  @Override
  public String chat(List<Message> messages) {
    log.trace("chat() called with {} message(s)", messages.size());
    long start = System.currentTimeMillis();
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<String> future = executor.submit(() -> runInference(messages));
      try {
        return future.get(timeoutSeconds, TimeUnit.SECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new LlmException("LLM inference timed out after " + timeoutSeconds + " seconds", e);
      } catch (ExecutionException e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e.getCause(), cause -> new LlmException("LLM inference failed: " + cause.getMessage(), cause));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmException("LLM inference was interrupted", e);
    } finally {
      executor.shutdownNow();
      log.debug("chat() took {} ms", System.currentTimeMillis() - start);
    }
  }

  /** Run one completion with the provider. Called on a worker thread. */
  protected abstract String runInference(List<Message> messages);
}
