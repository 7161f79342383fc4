package com.multila.backend.modules.feedback.presentation;

import com.multila.backend.global.security.SecurityUtils;
import com.multila.backend.modules.feedback.application.FeedbackService;
import com.multila.backend.modules.feedback.presentation.dto.UserFeedbackRequest;
import com.multila.backend.modules.feedback.presentation.dto.UserFeedbackResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Feedback")
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping({"/user_feedback", "/user_feedback/"})
    @Operation(summary = "Give feedback on a content section")
    public ResponseEntity<UserFeedbackResponse> submit(@Valid @RequestBody UserFeedbackRequest request) {
        Long id = feedbackService.submit(SecurityUtils.getCurrentClient(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new UserFeedbackResponse(id));
    }
}
