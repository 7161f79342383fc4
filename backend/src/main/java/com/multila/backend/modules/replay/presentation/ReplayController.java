package com.multila.backend.modules.replay.presentation;

import java.util.Map;
import java.util.Optional;

import com.multila.backend.modules.replay.application.ReplayDataService.ReplayDescriptor;
import com.multila.backend.modules.replay.application.ReplayService;
import com.multila.backend.modules.replay.presentation.dto.ReplayChunkResponse;
import com.multila.backend.modules.replay.presentation.dto.ReplayMessageRequest;
import com.multila.backend.modules.replay.presentation.dto.ReplayMessageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/replay")
@Tag(name = "Replay")
public class ReplayController {

    private final ReplayService replayService;

    public ReplayController(ReplayService replayService) {
        this.replayService = replayService;
    }

    @GetMapping("/{trackingSessionId}")
    @Operation(summary = "Describe a recorded tracking session for the replay surface")
    public ResponseEntity<ReplayDescriptor> describe(@PathVariable Long trackingSessionId) {
        return ResponseEntity.ok(replayService.describe(trackingSessionId));
    }

    @GetMapping("/{trackingSessionId}/chunks/{i}")
    @Operation(summary = "Fetch the i-th recorded event of a tracking session")
    public ResponseEntity<ReplayChunkResponse> chunk(@PathVariable Long trackingSessionId, @PathVariable int i) {
        ReplayDescriptor descriptor = replayService.describe(trackingSessionId);
        Optional<Map<String, Object>> event = replayService.chunk(trackingSessionId, i);
        if (event.isEmpty()) {
            return ResponseEntity.ok(new ReplayChunkResponse(null, null, null));
        }
        Long chunks = i == 0 ? descriptor.eventCount() : null;
        return ResponseEntity.ok(new ReplayChunkResponse(i, event.get(), chunks));
    }

    @PostMapping("/{trackingSessionId}/messages")
    @Operation(summary = "Apply one replay channel message and return the messages to deliver")
    public ResponseEntity<ReplayMessageResponse> message(@PathVariable Long trackingSessionId,
                                                         @Valid @RequestBody ReplayMessageRequest request) {
        return ResponseEntity.ok(ReplayMessageResponse.from(replayService.handle(
                trackingSessionId, request.state(), request.origin(), request.msgtype(), request.data())));
    }
}
