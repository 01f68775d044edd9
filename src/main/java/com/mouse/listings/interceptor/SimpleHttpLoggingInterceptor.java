package com.mouse.listings.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs method, host/path, status and elapsed time. Query strings and headers are
 * never logged since they may carry credentials. The body is left unread.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String target = describe(request.url());

        log.debug("→ {} {}", request.method(), target);
        long startNs = System.nanoTime();

        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← FAILED {} {} after {}ms: {}", request.method(), target, totalMs, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.info("← {} {} {} | Total: {}ms", response.code(), request.method(), target, totalMs);
        return response;
    }

    static String describe(HttpUrl url) {
        return url.host() + url.encodedPath();
    }
}
