package com.gentoro.govdir.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /** Client shared by every request of a run; cookies persist across requests. */
  public static OkHttpClient create(String userAgent, long connectTimeoutSeconds) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
        .followRedirects(true)
        .cookieJar(new SessionCookieJar())
        .addInterceptor(new UserAgentInterceptor(userAgent))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
