package com.mouse.listings.interfaces;

import com.mouse.listings.exception.NavigationException;

import java.time.Duration;

/**
 * One open browser page. Not thread-safe; used only by the worker that created it.
 */
public interface BrowserHandle extends AutoCloseable {

    /**
     * @throws NavigationException on timeout or browser error
     */
    void navigate(String url, Duration timeout);

    /**
     * @return false when the selector did not appear within the timeout
     */
    boolean waitForSelector(String selector, Duration timeout);

    /** Rendered HTML of the current page. */
    String content();

    /** Visible text of the current page body. */
    String visibleText();

    /** Closes page, context, browser and driver. Never throws. */
    @Override
    void close();
}
