package com.mouse.listings.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.listings.exception.DeviceNotFoundException;
import com.mouse.listings.model.profile.UserAgentProfile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;

@Component
@Slf4j
public class ProfileManager {
    static final String DEVICES_RESOURCE = "static/devices.json";

    private final List<UserAgentProfile> profiles = new CopyOnWriteArrayList<>();

    @PostConstruct
    void init() {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(DEVICES_RESOURCE)) {
            if (inputStream == null) {
                throw new IllegalStateException(DEVICES_RESOURCE + " not found in classpath.");
            }

            List<UserAgentProfile> deviceList = new ObjectMapper()
                    .readValue(inputStream, new TypeReference<List<UserAgentProfile>>() {});
            profiles.addAll(deviceList);

            log.info("Loaded {} device profiles", deviceList.size());
        } catch (Exception e) {
            log.error("Failed to load devices from JSON", e);
            throw new IllegalStateException("Device initialization failed", e);
        }
    }

    /**
     * Picks a profile at random so consecutive sessions do not share a fingerprint.
     */
    public UserAgentProfile getRandomProfile() {
        if (profiles.isEmpty()) {
            throw new DeviceNotFoundException("No device profile loaded");
        }
        UserAgentProfile profile = profiles.get(ThreadLocalRandom.current().nextInt(profiles.size()));
        log.debug("Selected profile | ID: {} | User-Agent: {}", profile.getId(), profile.getUserAgent());
        return profile;
    }

    public int size() {
        return profiles.size();
    }
}
