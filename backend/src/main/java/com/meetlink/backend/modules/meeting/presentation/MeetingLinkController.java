package com.meetlink.backend.modules.meeting.presentation;

import com.meetlink.backend.modules.meeting.application.MeetingJoinService;
import com.meetlink.backend.modules.meeting.application.MeetingLinkValidator;
import com.meetlink.backend.modules.meeting.presentation.dto.JoinMeetingRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.JoinMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.LinkValidationResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public endpoints reached from a join URL. The token is the only credential.
 */
@RestController
@RequestMapping("/meetings/links")
public class MeetingLinkController {

    private final MeetingLinkValidator meetingLinkValidator;
    private final MeetingJoinService meetingJoinService;

    public MeetingLinkController(MeetingLinkValidator meetingLinkValidator, MeetingJoinService meetingJoinService) {
        this.meetingLinkValidator = meetingLinkValidator;
        this.meetingJoinService = meetingJoinService;
    }

    @Operation(summary = "Preview a join link", description = "Read only. Always 200; `valid=false` carries a reason.")
    @GetMapping("/{token}")
    public ResponseEntity<LinkValidationResponse> validate(@PathVariable("token") String token) {
        return ResponseEntity.ok(meetingLinkValidator.validate(token));
    }

    @Operation(
            summary = "Join through a link",
            description = """
                    Consumes the link. Of concurrent joins on one link exactly one succeeds. \
                    The first join of a meeting starts its timer.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Joined"),
            @ApiResponse(responseCode = "404", description = "`LINK_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`LINK_USED`, `SESSION_CLOSED` or `SESSION_TIME_EXCEEDED`"),
            @ApiResponse(responseCode = "410", description = "`LINK_EXPIRED`"),
            @ApiResponse(responseCode = "503", description = "Provider unavailable, link left unused; honour `Retry-After`")
    })
    @PostMapping("/{token}/join")
    public ResponseEntity<JoinMeetingResponse> join(
            @PathVariable("token") String token,
            @Valid @RequestBody JoinMeetingRequest request
    ) {
        return ResponseEntity.ok(meetingJoinService.join(token, request));
    }
}
