package com.mouse.listings.manager;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.mouse.listings.config.ScraperConfig;
import com.mouse.listings.model.ProxyIdentity;
import com.mouse.listings.model.profile.UserAgentProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BrowserManagerTest {

    private BrowserManager browserManager;
    private UserAgentProfile profile;

    @BeforeEach
    void setUp() {
        ScraperConfig scraperConfig = new ScraperConfig();
        scraperConfig.setHeadless(true);
        scraperConfig.setBrowserLaunchTimeoutMs(30000);
        browserManager = new BrowserManager(scraperConfig);

        profile = UserAgentProfile.builder()
                .id("mac-chrome-129")
                .userAgent("Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) Chrome/129.0.0.0")
                .viewport(new UserAgentProfile.Viewport(1440, 900))
                .platform("MacIntel")
                .hardwareConcurrency(8)
                .timeZone("America/New_York")
                .locale("en-US")
                .languages(List.of("en-US", "en"))
                .build();
    }

    @Test
    void createLaunchOptions_routesThroughProxyWithCredentials() {
        BrowserType.LaunchOptions options = browserManager.createLaunchOptions(
                new ProxyIdentity("10.0.0.1", 8080, "user", "secret"));

        assertThat(options.headless).isTrue();
        assertThat(options.args).contains("--disable-blink-features=AutomationControlled");
        assertThat(options.proxy.server).isEqualTo("http://10.0.0.1:8080");
        assertThat(options.proxy.username).isEqualTo("user");
        assertThat(options.proxy.password).isEqualTo("secret");
    }

    @Test
    void createLaunchOptions_direct_hasNoProxy() {
        assertThat(browserManager.createLaunchOptions(null).proxy).isNull();
    }

    @Test
    void createStealthContextOptions_copiesProfile() {
        Browser.NewContextOptions options = browserManager.createStealthContextOptions(profile);

        assertThat(options.userAgent).isEqualTo(profile.getUserAgent());
        assertThat(options.locale).isEqualTo("en-US");
        assertThat(options.timezoneId).isEqualTo("America/New_York");
    }

    @Test
    void buildStealthScript_embedsProfileJson() {
        String script = browserManager.buildStealthScript(profile);

        assertThat(script)
                .contains("\"platform\":\"MacIntel\"")
                .contains("\"hardwareConcurrency\":8")
                .contains("navigator, 'webdriver'");
    }
}
