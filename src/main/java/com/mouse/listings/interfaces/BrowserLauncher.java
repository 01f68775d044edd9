package com.mouse.listings.interfaces;

import com.mouse.listings.exception.SessionCreationException;
import com.mouse.listings.model.ProxyIdentity;
import com.mouse.listings.model.profile.UserAgentProfile;

public interface BrowserLauncher {

    /**
     * Starts a browser routed through {@code proxy} (null for a direct connection)
     * and dressed with {@code profile}.
     *
     * @throws SessionCreationException when the browser process cannot start
     */
    BrowserHandle launch(ProxyIdentity proxy, UserAgentProfile profile);
}
