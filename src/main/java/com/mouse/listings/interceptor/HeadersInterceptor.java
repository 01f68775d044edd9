package com.mouse.listings.interceptor;

import com.mouse.listings.model.profile.UserAgentProfile;
import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;

import java.io.IOException;

/**
 * Dresses plain page fetches like a desktop browser navigation.
 */
@RequiredArgsConstructor
public class HeadersInterceptor implements Interceptor {

    private final UserAgentProfile userAgentProfile;
    private final String referer;

    @Override
    public okhttp3.Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();

        Request.Builder builder = original.newBuilder()
                .header("User-Agent", userAgentProfile != null ? userAgentProfile.getUserAgent() : "Mozilla/5.0")
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Upgrade-Insecure-Requests", "1");

        if (referer != null && !referer.isBlank()) {
            builder.header("Referer", referer);
        }

        return chain.proceed(builder.build());
    }
}
