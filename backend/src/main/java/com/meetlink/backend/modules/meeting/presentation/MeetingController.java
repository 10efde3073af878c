package com.meetlink.backend.modules.meeting.presentation;

import java.util.UUID;

import com.meetlink.backend.global.security.JwtAuthenticationPrincipal;
import com.meetlink.backend.global.security.SecurityUtils;
import com.meetlink.backend.modules.meeting.application.MeetingActor;
import com.meetlink.backend.modules.meeting.application.MeetingLinkIssuer;
import com.meetlink.backend.modules.meeting.application.MeetingTerminator;
import com.meetlink.backend.modules.meeting.application.MeetingTimeLimitService;
import com.meetlink.backend.modules.meeting.presentation.dto.CancelMeetingRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.CancelMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.CreateMeetingRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.CreateMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingRequest;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.MeetingStatusResponse;
import com.meetlink.backend.modules.meeting.presentation.dto.ReissueLinkResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/meetings")
public class MeetingController {

    private final MeetingLinkIssuer meetingLinkIssuer;
    private final MeetingTimeLimitService meetingTimeLimitService;
    private final MeetingTerminator meetingTerminator;

    public MeetingController(
            MeetingLinkIssuer meetingLinkIssuer,
            MeetingTimeLimitService meetingTimeLimitService,
            MeetingTerminator meetingTerminator
    ) {
        this.meetingLinkIssuer = meetingLinkIssuer;
        this.meetingTimeLimitService = meetingTimeLimitService;
        this.meetingTerminator = meetingTerminator;
    }

    @Operation(
            summary = "Create a meeting",
            description = """
                    Creates a provider room and a single-use join link. \
                    `durationMinutes` defaults to 40 and is clamped to the 40 minute ceiling. \
                    The link expires after that many minutes if nobody joins.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Meeting scheduled"),
            @ApiResponse(responseCode = "403", description = "Creating for another host without ADMIN, `HOST_MISMATCH`"),
            @ApiResponse(responseCode = "502", description = "Provider rejected the room, `PROVIDER_UNAVAILABLE`")
    })
    @PostMapping
    public ResponseEntity<CreateMeetingResponse> createMeeting(@Valid @RequestBody CreateMeetingRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(meetingLinkIssuer.issue(request, MeetingActor.of(principal), principal.loginId()));
    }

    @Operation(summary = "Replace the join link", description = "Revokes every unused link of the meeting and issues a new one.")
    @PostMapping("/{sessionId}/links")
    public ResponseEntity<ReissueLinkResponse> reissueLink(@PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(meetingLinkIssuer.reissue(sessionId, MeetingActor.current()));
    }

    @GetMapping("/{sessionId}/status")
    public ResponseEntity<MeetingStatusResponse> getStatus(@PathVariable("sessionId") UUID sessionId) {
        return ResponseEntity.ok(meetingTimeLimitService.status(sessionId));
    }

    @Operation(
            summary = "End a meeting",
            description = """
                    Idempotent: ending an ended meeting returns the stored outcome with `alreadyEnded=true`. \
                    `time_limit` is accepted from anyone once the limit is reached; \
                    `all_left` requires the host or a participant who joined through a link.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Meeting ended or already ended"),
            @ApiResponse(responseCode = "403", description = "`END_NOT_PERMITTED`"),
            @ApiResponse(responseCode = "409", description = "`SESSION_CANCELLED` or `TIME_LIMIT_NOT_REACHED`")
    })
    @PostMapping("/{sessionId}/end")
    public ResponseEntity<EndMeetingResponse> endMeeting(
            @PathVariable("sessionId") UUID sessionId,
            @Valid @RequestBody(required = false) EndMeetingRequest request
    ) {
        EndMeetingRequest body = request != null ? request : new EndMeetingRequest(null, null);
        return ResponseEntity.ok(meetingTerminator.end(sessionId, body.reasonOrDefault(), body.durationSeconds(),
                MeetingActor.current()));
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<CancelMeetingResponse> cancelMeeting(
            @PathVariable("sessionId") UUID sessionId,
            @Valid @RequestBody(required = false) CancelMeetingRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(meetingTerminator.cancel(sessionId, reason, MeetingActor.current()));
    }
}
