package com.multila.backend.modules.registry.application;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.registry.domain.ApplicationSession;
import com.multila.backend.modules.registry.domain.ApplicationSessionGate;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationSessionGateRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Round-robin forwarding through application session gates.
 */
@Service
public class GateService {

    private static final Logger log = LoggerFactory.getLogger(GateService.class);

    private final ApplicationSessionGateRepository gateRepository;

    public GateService(ApplicationSessionGateRepository gateRepository) {
        this.gateRepository = gateRepository;
    }

    /**
     * @return public URL of the application session the visitor is forwarded to
     * @throws ProblemException 404 {@code GATE_NOT_FOUND} for an unknown, inactive or empty gate
     */
    @Transactional
    public String forward(String gateCode) {
        ApplicationSessionGate gate = gateRepository.findByCodeForUpdate(gateCode)
                .orElseThrow(() -> gateNotFound(gateCode));
        ApplicationSession target = gate.forwardNext()
                .orElseThrow(() -> gateNotFound(gateCode));
        log.debug("Gate {} forwards to application session {}", gateCode, target.getCode());
        return target.sessionUrl();
    }

    private static ProblemException gateNotFound(String gateCode) {
        return new ProblemException(HttpStatus.NOT_FOUND, "GATE_NOT_FOUND",
                "no active application session behind gate " + gateCode);
    }
}
