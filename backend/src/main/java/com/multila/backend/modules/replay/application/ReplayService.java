package com.multila.backend.modules.replay.application;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.multila.backend.modules.replay.application.ReplayDataService.ReplayDescriptor;
import com.multila.backend.modules.replay.domain.ReplaySource;
import com.multila.backend.modules.replay.domain.ReplayState;
import com.multila.backend.modules.replay.domain.ReplayStateMachine;
import com.multila.backend.modules.replay.domain.ReplayTransition;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Applies replay channel messages. The client carries the current state; nothing is kept between calls.
 */
@Service
public class ReplayService {

    private final ReplayDataService replayDataService;
    private final ReplayStateMachine stateMachine;

    public ReplayService(
            ReplayDataService replayDataService,
            @Value("${multila.replay.reload-grace-period:PT3S}") Duration reloadGracePeriod
    ) {
        this.replayDataService = replayDataService;
        this.stateMachine = new ReplayStateMachine(reloadGracePeriod);
    }

    public ReplayDescriptor describe(Long trackingSessionId) {
        return replayDataService.describe(trackingSessionId);
    }

    public Optional<Map<String, Object>> chunk(Long trackingSessionId, int index) {
        return replayDataService.event(trackingSessionId, index);
    }

    public ReplayTransition handle(Long trackingSessionId, ReplayState state, String origin, String msgtype, Object data) {
        ReplayDescriptor descriptor = replayDataService.describe(trackingSessionId);
        ReplaySource source = new ReplaySource() {
            @Override
            public String embedOrigin() {
                return descriptor.embedOrigin();
            }

            @Override
            public String controllerOrigin() {
                return descriptor.controllerOrigin();
            }

            @Override
            public Map<String, Object> recordedConfig() {
                return descriptor.config();
            }

            @Override
            public long eventCount() {
                return descriptor.eventCount();
            }

            @Override
            public Optional<Map<String, Object>> event(int index) {
                return replayDataService.event(trackingSessionId, index);
            }
        };
        return stateMachine.handle(state == null ? ReplayState.UNINITIALIZED : state, origin, msgtype, data, source);
    }
}
