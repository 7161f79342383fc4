package com.multila.backend.modules.tracking.presentation;

import com.multila.backend.global.security.SecurityUtils;
import com.multila.backend.modules.tracking.application.TrackingService;
import com.multila.backend.modules.tracking.presentation.dto.CloseTrackingSessionRequest;
import com.multila.backend.modules.tracking.presentation.dto.OpenTrackingSessionRequest;
import com.multila.backend.modules.tracking.presentation.dto.TrackingEventRequest;
import com.multila.backend.modules.tracking.presentation.dto.TrackingSessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Tracking")
public class TrackingController {

    private final TrackingService trackingService;

    public TrackingController(TrackingService trackingService) {
        this.trackingService = trackingService;
    }

    @PostMapping({"/tracking_session", "/tracking_session/"})
    @Operation(summary = "Open a tracking session, closing any still-open one of the same user session")
    public ResponseEntity<TrackingSessionResponse> open(@RequestBody(required = false) OpenTrackingSessionRequest request) {
        OpenTrackingSessionRequest effective = request != null ? request : new OpenTrackingSessionRequest(null, null, null);
        Long id = trackingService.open(SecurityUtils.getCurrentClient(), effective);
        return ResponseEntity.status(HttpStatus.CREATED).body(new TrackingSessionResponse(id));
    }

    @PostMapping({"/tracking_session/close", "/tracking_session/close/"})
    @Operation(summary = "Close a tracking session")
    public ResponseEntity<TrackingSessionResponse> close(@Valid @RequestBody CloseTrackingSessionRequest request) {
        Long id = trackingService.close(SecurityUtils.getCurrentClient(), request);
        return ResponseEntity.ok(new TrackingSessionResponse(id));
    }

    @PostMapping({"/tracking_event", "/tracking_event/"})
    @Operation(summary = "Append one event to a tracking session")
    public ResponseEntity<Void> append(@Valid @RequestBody TrackingEventRequest request) {
        trackingService.append(SecurityUtils.getCurrentClient(), request);
        return ResponseEntity.noContent().build();
    }
}
