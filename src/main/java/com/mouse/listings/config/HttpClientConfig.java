package com.mouse.listings.config;

import com.mouse.listings.interceptor.SimpleHttpLoggingInterceptor;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final ScraperConfig scraperConfig;

    /**
     * Shared base client. Callers needing a proxy or extra interceptors derive
     * from it with {@code newBuilder()} so the connection pool is reused.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        int timeoutMs = scraperConfig.getRequestTimeoutMs();
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
                .retryOnConnectionFailure(true)
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();
    }
}
