package com.gentoro.kbo.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class OkHttpFactory {

  public static OkHttpClient create(Configuration configuration) {
    int connectTimeout = configuration.getInt("http.connect-timeout-seconds", 10);
    int readTimeout = configuration.getInt("http.read-timeout-seconds", 20);
    return create(connectTimeout, readTimeout);
  }

  public static OkHttpClient create(int connectTimeoutSeconds, int readTimeoutSeconds) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
        .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
