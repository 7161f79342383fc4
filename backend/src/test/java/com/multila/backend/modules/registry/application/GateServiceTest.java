package com.multila.backend.modules.registry.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.registry.domain.ApplicationSessionGate;
import com.multila.backend.modules.registry.domain.AuthMode;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationSessionGateRepository;
import com.multila.backend.support.DomainFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GateServiceTest {

    @Mock
    private ApplicationSessionGateRepository gateRepository;

    private GateService service;

    @BeforeEach
    void setUp() {
        service = new GateService(gateRepository);
    }

    @Test
    void forwardsToSessionUrlOfNextMember() {
        ApplicationSessionGate gate = new ApplicationSessionGate("G1", "study");
        gate.getApplicationSessions().add(DomainFixtures.applicationSession("A1", AuthMode.NONE));
        gate.getApplicationSessions().add(DomainFixtures.applicationSession("B1", AuthMode.NONE));
        when(gateRepository.findByCodeForUpdate("G1")).thenReturn(Optional.of(gate));

        assertThat(service.forward("G1")).isEqualTo("https://apps.example.org/demo/?sess=A1");
        assertThat(service.forward("G1")).isEqualTo("https://apps.example.org/demo/?sess=B1");
        assertThat(gate.getNextForwardIndex()).isZero();
    }

    @Test
    void unknownGateIsNotFound() {
        when(gateRepository.findByCodeForUpdate("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.forward("nope"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("GATE_NOT_FOUND"));
    }

    @Test
    void gateWithoutActiveMembersIsNotFound() {
        ApplicationSessionGate gate = new ApplicationSessionGate("G2", "closed");
        gate.setActive(false);
        gate.getApplicationSessions().add(DomainFixtures.applicationSession("A1", AuthMode.NONE));
        when(gateRepository.findByCodeForUpdate("G2")).thenReturn(Optional.of(gate));

        assertThatThrownBy(() -> service.forward("G2"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("GATE_NOT_FOUND"));
    }
}
