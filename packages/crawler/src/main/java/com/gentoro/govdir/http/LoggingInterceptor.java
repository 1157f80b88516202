package com.gentoro.govdir.http;

import java.io.IOException;
import okhttp3.*;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("GET {}", request.url());

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "{} {} in {} ms",
        response.code(),
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d));
    if (log.isTraceEnabled()) {
      log.trace("Response headers:\n{}", response.headers());
    }

    return response;
  }
}
