package com.multila.backend.modules.export.application;

import com.multila.backend.global.error.ProblemException;
import com.multila.backend.modules.export.domain.ExportFilter;
import com.multila.backend.modules.registry.domain.ApplicationConfig;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationConfigRepository;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationRepository;
import com.multila.backend.modules.registry.infrastructure.persistence.ApplicationSessionRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class ExportFilterValidator {

    private final ApplicationRepository applicationRepository;
    private final ApplicationConfigRepository applicationConfigRepository;
    private final ApplicationSessionRepository applicationSessionRepository;

    public ExportFilterValidator(
            ApplicationRepository applicationRepository,
            ApplicationConfigRepository applicationConfigRepository,
            ApplicationSessionRepository applicationSessionRepository
    ) {
        this.applicationRepository = applicationRepository;
        this.applicationConfigRepository = applicationConfigRepository;
        this.applicationSessionRepository = applicationSessionRepository;
    }

    /**
     * @throws ProblemException 422 {@code INVALID_EXPORT_FILTER}
     */
    @Transactional(readOnly = true)
    public void validate(ExportFilter filter) {
        if (filter.from() != null && filter.to() != null && filter.from().isAfter(filter.to())) {
            throw invalid("from must not be after to");
        }
        if (filter.applicationId() != null && !applicationRepository.existsById(filter.applicationId())) {
            throw invalid("unknown application " + filter.applicationId());
        }
        if (filter.configId() != null) {
            ApplicationConfig config = applicationConfigRepository.findById(filter.configId())
                    .orElseThrow(() -> invalid("unknown application config " + filter.configId()));
            if (filter.applicationId() != null && !config.getApplication().getId().equals(filter.applicationId())) {
                throw invalid("config " + filter.configId() + " does not belong to application " + filter.applicationId());
            }
        }
        if (filter.appSessCode() != null && !applicationSessionRepository.existsById(filter.appSessCode())) {
            throw invalid("unknown application session " + filter.appSessCode());
        }
    }

    private static ProblemException invalid(String detail) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_EXPORT_FILTER", detail);
    }
}
