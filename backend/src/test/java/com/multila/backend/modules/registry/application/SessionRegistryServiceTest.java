package com.multila.backend.modules.registry.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.multila.backend.global.common.SecureCodeGenerator;
import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.identity.domain.PlatformUser;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.modules.registry.domain.UserApplicationSession;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationRepository;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationSessionRepository;
import com.multila.backend.modules.registry.infrastructure.persistence.UserApplicationSessionRepository;
import com.multila.backend.support.DomainFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionRegistryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private ApplicationRepository applicationRepository;
    @Mock
    private ApplicationSessionRepository applicationSessionRepository;
    @Mock
    private UserApplicationSessionRepository userApplicationSessionRepository;
    @Mock
    private SecureCodeGenerator codeGenerator;

    private SessionRegistryService service;

    @BeforeEach
    void setUp() {
        service = new SessionRegistryService(applicationRepository, applicationSessionRepository,
                userApplicationSessionRepository, codeGenerator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void disabledSessionIsNotFound() {
        ApplicationSession session = DomainFixtures.applicationSession("S1", AuthMode.NONE);
        session.setActive(false);
        when(applicationSessionRepository.findByCode("S1")).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> service.resolveActiveSession("S1"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("APP_SESSION_NOT_FOUND"));
    }

    @Test
    void blankCodeIsNotFoundWithoutLookup() {
        assertThatThrownBy(() -> service.resolveActiveSession(""))
                .isInstanceOf(ProblemException.class);
        verify(applicationSessionRepository, never()).findByCode(anyString());
    }

    @Test
    void registeredUserSessionIsReturnedWhenPresent() {
        ApplicationSession session = DomainFixtures.applicationSession("S2", AuthMode.LOGIN);
        PlatformUser user = DomainFixtures.user("alice", "hash");
        UserApplicationSession existing = DomainFixtures.registeredUserSession(3L, "u", session, user, NOW_UTC);
        when(userApplicationSessionRepository.findRegistered("S2", user.getId())).thenReturn(Optional.of(existing));

        assertThat(service.createOrFetchRegisteredUserSession(session, user)).isSameAs(existing);
        verify(userApplicationSessionRepository, never()).insertRegisteredIfAbsent(anyString(), anyString(), any(), any());
    }

    @Test
    void registeredUserSessionIsInsertedThenRead() {
        ApplicationSession session = DomainFixtures.applicationSession("S2", AuthMode.LOGIN);
        PlatformUser user = DomainFixtures.user("alice", "hash");
        UserApplicationSession inserted = DomainFixtures.registeredUserSession(3L, "code", session, user, NOW_UTC);
        when(codeGenerator.nextHex()).thenReturn("code");
        when(userApplicationSessionRepository.findRegistered("S2", user.getId()))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(inserted));
        when(userApplicationSessionRepository.insertRegisteredIfAbsent("code", "S2", user.getId(), NOW_UTC))
                .thenReturn(1);

        assertThat(service.createOrFetchRegisteredUserSession(session, user).getCode()).isEqualTo("code");
    }

    @Test
    void registeredUserSessionRequiresLoginMode() {
        ApplicationSession session = DomainFixtures.applicationSession("S1", AuthMode.NONE);
        PlatformUser user = DomainFixtures.user("alice", "hash");

        assertThatThrownBy(() -> service.createOrFetchRegisteredUserSession(session, user))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("AUTH_MODE_MISMATCH"));
    }

    @Test
    void configPayloadIsACopy() {
        ApplicationSession session = DomainFixtures.applicationSession("S1", AuthMode.NONE);

        Map<String, Object> payload = service.configPayload(session);
        payload.put("extra", true);

        assertThat(session.getConfig().getConfig()).doesNotContainKey("extra");
    }

    @Test
    void defaultSessionIsFoundByReferrerUrl() {
        ApplicationSession session = DomainFixtures.applicationSession("S1", AuthMode.NONE);
        session.getConfig().getApplication().setDefaultApplicationSession(session);
        when(applicationRepository.findAllWithActiveDefaultSession())
                .thenReturn(List.of(session.getConfig().getApplication()));

        assertThat(service.findDefaultSessionCode("https://apps.example.org/demo/")).contains("S1");
        assertThat(service.findDefaultSessionCode("https://elsewhere.example.org/")).isEmpty();
    }
}
