package com.mouse.listings.manager;

import com.mouse.listings.interfaces.BrowserHandle;
import com.mouse.listings.model.ProxyIdentity;
import com.mouse.listings.model.profile.UserAgentProfile;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A browser page bound to one egress identity. Owned by a single worker at a time.
 */
@Getter
public class Session implements AutoCloseable {

    private final String id;
    private final ProxyIdentity egressIdentity;
    private final BrowserHandle browserHandle;
    private final UserAgentProfile profile;
    private final Instant createdAt;

    public Session(ProxyIdentity egressIdentity, BrowserHandle browserHandle, UserAgentProfile profile) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.egressIdentity = egressIdentity;
        this.browserHandle = browserHandle;
        this.profile = profile;
        this.createdAt = Instant.now();
    }

    @Override
    public void close() {
        browserHandle.close();
    }

    @Override
    public String toString() {
        return "Session[" + id + " via " + (egressIdentity != null ? egressIdentity : "direct") + "]";
    }
}
