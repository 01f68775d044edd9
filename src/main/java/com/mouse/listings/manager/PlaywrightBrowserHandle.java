package com.mouse.listings.manager;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import com.mouse.listings.exception.NavigationException;
import com.mouse.listings.interfaces.BrowserHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Slf4j
@RequiredArgsConstructor
public class PlaywrightBrowserHandle implements BrowserHandle {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    @Override
    public void navigate(String url, Duration timeout) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(timeout.toMillis())
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (TimeoutError e) {
            throw new NavigationException("Navigation timed out after " + timeout.toMillis() + "ms: " + url, e);
        } catch (PlaywrightException e) {
            throw new NavigationException("Navigation failed: " + url, e);
        }
    }

    @Override
    public boolean waitForSelector(String selector, Duration timeout) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions()
                    .setTimeout(timeout.toMillis())
                    .setState(WaitForSelectorState.ATTACHED));
            return true;
        } catch (TimeoutError e) {
            log.debug("Selector not found in time | Selector: {} | Timeout: {}ms", selector, timeout.toMillis());
            return false;
        } catch (PlaywrightException e) {
            throw new NavigationException("Waiting for " + selector + " failed", e);
        }
    }

    @Override
    public String content() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new NavigationException("Could not read page content", e);
        }
    }

    @Override
    public String visibleText() {
        try {
            return page.innerText("body");
        } catch (PlaywrightException e) {
            throw new NavigationException("Could not read page text", e);
        }
    }

    @Override
    public void close() {
        safeClose(page);
        safeClose(context);
        safeClose(browser);
        safeClose(playwright);
    }

    private void safeClose(AutoCloseable c) {
        try {
            if (c != null) c.close();
        } catch (Exception e) {
            log.debug("Ignoring close error: {}", e.getMessage());
        }
    }
}
