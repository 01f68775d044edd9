package com.mouse.listings.manager;

import com.google.gson.Gson;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.mouse.listings.config.ScraperConfig;
import com.mouse.listings.exception.SessionCreationException;
import com.mouse.listings.interfaces.BrowserHandle;
import com.mouse.listings.interfaces.BrowserLauncher;
import com.mouse.listings.model.ProxyIdentity;
import com.mouse.listings.model.profile.UserAgentProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Launches headless Chromium sessions. The Playwright driver is created on the
 * calling thread and must stay on it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserManager implements BrowserLauncher {

    private static final Set<String> HEAVY_RESOURCES = Set.of("image", "media", "font");
    private static final Gson GSON = new Gson();

    private final ScraperConfig scraperConfig;

    @Override
    public BrowserHandle launch(ProxyIdentity proxy, UserAgentProfile profile) {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(createLaunchOptions(proxy));
            BrowserContext context = browser.newContext(createStealthContextOptions(profile));
            attachAntiDetection(context, profile);
            if (scraperConfig.isBlockHeavyResources()) {
                blockHeavyResources(context);
            }
            Page page = context.newPage();
            log.info("Browser session launched | Proxy: {} | Profile: {}",
                    proxy != null ? proxy : "direct", profile.getId());
            return new PlaywrightBrowserHandle(playwright, browser, context, page);
        } catch (RuntimeException e) {
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (Exception closeError) {
                    log.debug("Ignoring close error: {}", closeError.getMessage());
                }
            }
            throw new SessionCreationException("Browser failed to start", e);
        }
    }

    BrowserType.LaunchOptions createLaunchOptions(ProxyIdentity proxy) {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(scraperConfig.isHeadless())
                .setTimeout(scraperConfig.getBrowserLaunchTimeoutMs())
                .setArgs(scraperConfig.getBROWSER_FLAGS());

        if (proxy != null) {
            Proxy playwrightProxy = new Proxy(proxy.server());
            if (proxy.hasCredentials()) {
                playwrightProxy.setUsername(proxy.username()).setPassword(proxy.password());
            }
            options.setProxy(playwrightProxy);
        }
        return options;
    }

    Browser.NewContextOptions createStealthContextOptions(UserAgentProfile profile) {
        UserAgentProfile.Viewport viewport = profile.getViewport();
        Browser.NewContextOptions options = new Browser.NewContextOptions()
                .setUserAgent(profile.getUserAgent())
                .setLocale(profile.getLocale() != null ? profile.getLocale() : "en-US")
                .setServiceWorkers(ServiceWorkerPolicy.BLOCK);

        if (viewport != null && viewport.getWidth() != null && viewport.getHeight() != null) {
            options.setViewportSize(viewport.getWidth(), viewport.getHeight());
        }
        if (profile.getTimeZone() != null) {
            options.setTimezoneId(profile.getTimeZone());
        }
        return options;
    }

    private void attachAntiDetection(BrowserContext context, UserAgentProfile profile) {
        context.addInitScript(buildStealthScript(profile));
        log.debug("Stealth script injected | Profile: {}", profile.getId());
    }

    private void blockHeavyResources(BrowserContext context) {
        context.route("**/*", route -> {
            if (HEAVY_RESOURCES.contains(route.request().resourceType())) {
                route.abort();
            } else {
                route.resume();
            }
        });
    }

    String buildStealthScript(UserAgentProfile profile) {
        return String.format("""
        const profile = %s;

        // === Remove Automation Indicators ===
        Object.defineProperty(navigator, 'webdriver', {
            get: () => undefined,
            configurable: true
        });
        delete navigator.__proto__.webdriver;
        window.chrome = { runtime: {} };

        // === Device Properties ===
        if (profile.platform) {
            Object.defineProperty(navigator, 'platform', { get: () => profile.platform });
        }
        if (profile.hardwareConcurrency) {
            Object.defineProperty(navigator, 'hardwareConcurrency', { get: () => profile.hardwareConcurrency });
        }
        if (profile.deviceMemory) {
            Object.defineProperty(navigator, 'deviceMemory', { get: () => profile.deviceMemory });
        }
        if (profile.languages) {
            Object.defineProperty(navigator, 'languages', { get: () => profile.languages });
        }

        // === Client Hints ===
        if (profile.clientHints) {
            Object.defineProperty(navigator, 'userAgentData', {
                get: () => ({
                    brands: profile.clientHints.brands || [],
                    mobile: !!profile.clientHints.mobile,
                    platform: profile.clientHints.platform || ''
                }),
                configurable: true
            });
        }

        // === WebGL Vendor ===
        if (profile.webgl) {
            const getParameter = WebGLRenderingContext.prototype.getParameter;
            WebGLRenderingContext.prototype.getParameter = function(parameter) {
                if (parameter === 37445) return profile.webgl.vendor;
                if (parameter === 37446) return profile.webgl.renderer;
                return getParameter.call(this, parameter);
            };
        }

        // === Permissions ===
        const originalQuery = window.navigator.permissions && window.navigator.permissions.query;
        if (originalQuery) {
            window.navigator.permissions.query = (parameters) => (
                parameters.name === 'notifications'
                    ? Promise.resolve({ state: Notification.permission })
                    : originalQuery(parameters)
            );
        }
        """, GSON.toJson(profile));
    }
}
