package com.multila.backend.support;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.multila.backend.modules.identity.domain.PlatformUser;
import com.multila.backend.modules.registry.domain.Application;
import com.multila.backend.modules.registry.domain.ApplicationConfig;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.modules.registry.domain.UserApplicationSession;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Detached entities for unit tests that never touch the database.
 */
public final class DomainFixtures {

    private DomainFixtures() {
    }

    public static ApplicationSession applicationSession(String code, AuthMode authMode) {
        Application application = new Application();
        ReflectionTestUtils.setField(application, "id", 1L);
        application.setName("demo");
        application.setUrl("https://apps.example.org/demo");

        ApplicationConfig config = new ApplicationConfig();
        ReflectionTestUtils.setField(config, "id", 2L);
        config.setApplication(application);
        config.setLabel("default");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("exercises", Map.of("ex1", Map.of("hints", 2)));
        config.setConfig(payload);

        return new ApplicationSession(code, config, authMode);
    }

    public static UserApplicationSession anonymousUserSession(long id, String code,
                                                              ApplicationSession applicationSession,
                                                              OffsetDateTime createdAt) {
        UserApplicationSession userSession = UserApplicationSession.anonymous(code, applicationSession, createdAt);
        ReflectionTestUtils.setField(userSession, "id", id);
        return userSession;
    }

    public static UserApplicationSession registeredUserSession(long id, String code,
                                                               ApplicationSession applicationSession,
                                                               PlatformUser user, OffsetDateTime createdAt) {
        UserApplicationSession userSession = anonymousUserSession(id, code, applicationSession, createdAt);
        ReflectionTestUtils.setField(userSession, "user", user);
        return userSession;
    }

    public static PlatformUser user(String username, String passwordHash) {
        PlatformUser user = new PlatformUser(username, username + "@example.org", passwordHash);
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        return user;
    }
}
