package com.meetlink.backend.modules.meeting.presentation;

import com.meetlink.backend.modules.meeting.application.ProviderEventService;
import com.meetlink.backend.modules.meeting.presentation.dto.ProviderEventRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.ProviderEventResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProviderEventController {

    static final String SIGNATURE_HEADER = "X-Provider-Signature";

    private final ProviderEventService providerEventService;

    public ProviderEventController(ProviderEventService providerEventService) {
        this.providerEventService = providerEventService;
    }

    @PostMapping("/meetings/provider-events")
    public ResponseEntity<ProviderEventResponse> receive(
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @Valid @RequestBody ProviderEventRequest request
    ) {
        return ResponseEntity.ok(providerEventService.handle(signature, request));
    }
}
