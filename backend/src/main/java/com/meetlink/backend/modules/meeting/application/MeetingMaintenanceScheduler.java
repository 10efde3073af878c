package com.meetlink.backend.modules.meeting.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.Period;
import java.util.List;
import java.util.UUID;

import com.meetlink.backend.global.error.ProblemException;
import com.meetlink.backend.modules.meeting.domain.MeetingEndReason;
import com.meetlink.backend.modules.meeting.infrastructure.persistence.MeetingSessionRepository;
import com.meetlink.backend.modules.meeting.presentation.dto.EndMeetingResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Server-side backstop for the time limit: ends active meetings whose timer ran out even
 * when no client reports it, and purges links long past their expiry.
 */
@Component
@ConditionalOnProperty(prefix = "app.meeting.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MeetingMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MeetingMaintenanceScheduler.class);

    private final MeetingSessionRepository meetingSessionRepository;
    private final MeetingLifecycleService meetingLifecycleService;
    private final MeetingTerminator meetingTerminator;
    private final Clock clock;
    private final int batchSize;
    private final Period linkRetention;

    public MeetingMaintenanceScheduler(
            MeetingSessionRepository meetingSessionRepository,
            MeetingLifecycleService meetingLifecycleService,
            MeetingTerminator meetingTerminator,
            Clock clock,
            @Value("${app.meeting.sweep.batch-size:100}") int batchSize,
            @Value("${app.meeting.link-retention:P7D}") Period linkRetention
    ) {
        this.meetingSessionRepository = meetingSessionRepository;
        this.meetingLifecycleService = meetingLifecycleService;
        this.meetingTerminator = meetingTerminator;
        this.clock = clock;
        this.batchSize = Math.max(1, batchSize);
        this.linkRetention = linkRetention;
    }

    @Scheduled(fixedDelayString = "${app.meeting.sweep.interval:PT1M}")
    public void sweepOverdueMeetings() {
        int ended = endOverdueMeetings();
        if (ended > 0) {
            log.info("Ended {} meeting(s) past their time limit", ended);
        }
    }

    @Scheduled(cron = "${app.meeting.link-retention-cron:0 30 3 * * *}", zone = "UTC")
    public void purgeStaleLinks() {
        int purged = purgeExpiredLinks();
        if (purged > 0) {
            log.info("Purged {} link(s) expired for more than {}", purged, linkRetention);
        }
    }

    int endOverdueMeetings() {
        List<UUID> overdue = meetingSessionRepository.findOverdueActiveIds(OffsetDateTime.now(clock),
                PageRequest.of(0, batchSize));
        int ended = 0;
        for (UUID sessionId : overdue) {
            try {
                EndMeetingResponse response = meetingTerminator.end(sessionId, MeetingEndReason.TIME_LIMIT, null,
                        MeetingActor.systemActor());
                if (!response.alreadyEnded()) {
                    ended++;
                }
            } catch (ProblemException ex) {
                log.warn("Overdue meeting {} was not ended: {}", sessionId, ex.getCode());
            } catch (TransientDataAccessException ex) {
                // picked up again by the next sweep
                log.warn("Overdue meeting {} was not ended this round: {}", sessionId,
                        ex.getMostSpecificCause().getMessage());
            }
        }
        return ended;
    }

    int purgeExpiredLinks() {
        return meetingLifecycleService.purgeLinksExpiredBefore(OffsetDateTime.now(clock).minus(linkRetention));
    }
}
