package com.mouse.cricket.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.cricket.model.profile.UserAgentProfile;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Component
@Slf4j
public class ProfileManager {
    private final List<UserAgentProfile> profiles = new ArrayList<>();
    private final AtomicInteger currentIndex = new AtomicInteger(0);

    @PostConstruct
    void init() {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream("static/devices.json")) {
            if (inputStream == null) {
                throw new IllegalStateException("devices.json not found in classpath.");
            }

            ObjectMapper mapper = new ObjectMapper();
            List<UserAgentProfile> deviceList = mapper.readValue(inputStream, new TypeReference<List<UserAgentProfile>>() {});
            profiles.addAll(deviceList);

            log.info("Loaded {} browser profiles", deviceList.size());
        } catch (Exception e) {
            log.error("Failed to load browser profiles", e);
            throw new IllegalStateException("Browser profile initialization failed", e);
        }
    }

    public UserAgentProfile getNextProfile() {
        if (profiles.isEmpty()) {
            throw new IllegalStateException("No browser profile loaded");
        }

        int index = currentIndex.getAndUpdate(i -> (i + 1) % profiles.size());
        UserAgentProfile agentProfile = profiles.get(index);

        log.debug("Selected profile index: {}, ID: {}", index, agentProfile.getId());
        return agentProfile;
    }

    public int profileCount() {
        return profiles.size();
    }
}
