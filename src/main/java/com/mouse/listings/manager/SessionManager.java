package com.mouse.listings.manager;

import com.mouse.listings.exception.ProxyUnavailableException;
import com.mouse.listings.exception.SessionCreationException;
import com.mouse.listings.interfaces.BrowserHandle;
import com.mouse.listings.interfaces.BrowserLauncher;
import com.mouse.listings.model.ProxyIdentity;
import com.mouse.listings.model.profile.UserAgentProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates and recycles browser sessions. Stateless apart from counters; callers
 * hold the {@link Session} they were given and hand it back on reset or release.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionManager {

    private final ProxyProvider proxyProvider;
    private final ProfileManager profileManager;
    private final BrowserLauncher browserLauncher;

    private final AtomicLong sessionsCreated = new AtomicLong();
    private final AtomicLong sessionsReset = new AtomicLong();

    /**
     * @throws SessionCreationException when no proxy is available or the browser cannot start
     */
    public Session acquire() {
        ProxyIdentity proxy = null;
        if (proxyProvider.isEnabled()) {
            try {
                proxy = proxyProvider.pickRandom();
            } catch (ProxyUnavailableException e) {
                throw new SessionCreationException("No proxy identity available", e);
            }
        }

        UserAgentProfile profile = profileManager.getRandomProfile();
        BrowserHandle handle;
        try {
            handle = browserLauncher.launch(proxy, profile);
        } catch (SessionCreationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SessionCreationException("Browser failed to start", e);
        }

        Session session = new Session(proxy, handle, profile);
        sessionsCreated.incrementAndGet();
        log.info("Session acquired | Session: {} | Profile: {}", session, profile.getId());
        return session;
    }

    /**
     * Tears the session down and returns a fresh one on a new egress identity.
     */
    public Session reset(Session session) {
        log.info("Resetting session | Session: {}", session);
        release(session);
        sessionsReset.incrementAndGet();
        return acquire();
    }

    public void release(Session session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception e) {
            log.debug("Ignoring close error | Session: {} | Error: {}", session, e.getMessage());
        }
    }

    public long getSessionsCreated() {
        return sessionsCreated.get();
    }

    public long getSessionsReset() {
        return sessionsReset.get();
    }
}
