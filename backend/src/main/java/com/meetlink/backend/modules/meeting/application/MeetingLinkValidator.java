package com.meetlink.backend.modules.meeting.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.meetlink.backend.modules.meeting.domain.LinkInvalidReason;
import com.meetlink.backend.modules.meeting.domain.MeetingLink;
import com.meetlink.backend.modules.meeting.domain.MeetingSession;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingLinkRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.LinkValidationResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Read-only preview of a join link. Never consumes it, so a valid answer here says nothing
 * about whether a following join will win.
 */
@Service
@Transactional(readOnly = true)
public class MeetingLinkValidator {

    private final MeetingLinkRepository meetingLinkRepository;
    private final Clock clock;

    public MeetingLinkValidator(MeetingLinkRepository meetingLinkRepository, Clock clock) {
        this.meetingLinkRepository = meetingLinkRepository;
        this.clock = clock;
    }

    public LinkValidationResponse validate(String token) {
        if (!StringUtils.hasText(token)) {
            return LinkValidationResponse.invalid(LinkInvalidReason.NOT_FOUND);
        }
        Optional<MeetingLink> found = meetingLinkRepository.findByTokenWithSession(token);
        if (found.isEmpty()) {
            return LinkValidationResponse.invalid(LinkInvalidReason.NOT_FOUND);
        }

        MeetingLink link = found.get();
        MeetingSession session = link.getSession();
        OffsetDateTime now = OffsetDateTime.now(clock);
        // A closed session revokes its links; report those as expired even if revocation has not run yet.
        if (link.isExpiredAt(now) || session.getStatus().isClosed()) {
            return LinkValidationResponse.invalid(LinkInvalidReason.EXPIRED);
        }
        if (link.isUsed() || link.isExhausted()) {
            return LinkValidationResponse.invalid(LinkInvalidReason.USED);
        }
        return LinkValidationResponse.valid(new LinkValidationResponse.SessionSummary(
                session.getId(),
                session.getTitle(),
                session.getHostName(),
                link.getExpiresAt()
        ));
    }
}
