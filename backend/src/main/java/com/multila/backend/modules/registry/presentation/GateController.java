package com.multila.backend.modules.registry.presentation;

import java.net.URI;

import com.multila.backend.modules.registry.application.GateService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Session registry")
public class GateController {

    private final GateService gateService;

    public GateController(GateService gateService) {
        this.gateService = gateService;
    }

    @GetMapping({"/gate/{code}", "/gate/{code}/"})
    @Operation(summary = "Redirect to the next application session behind a gate")
    public ResponseEntity<Void> forward(@PathVariable String code) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(gateService.forward(code)))
                .build();
    }
}
