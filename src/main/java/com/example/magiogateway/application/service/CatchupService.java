package com.example.magiogateway.application.service;

import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.CatchupAvailability;
import com.example.magiogateway.domain.model.Program;
import com.example.magiogateway.domain.model.StreamInfo;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class CatchupService {

    private static final Logger log = LoggerFactory.getLogger(CatchupService.class);

    private static final int ARCHIVE_DAYS = 7;
    private static final double MILLIS_PER_DAY = 86_400_000d;

    private final EpgService epgService;
    private final StreamService streamService;
    private final Clock clock;

    @Autowired
    public CatchupService(EpgService epgService, StreamService streamService) {
        this(epgService, streamService, Clock.systemUTC());
    }

    CatchupService(EpgService epgService, StreamService streamService, Clock clock) {
        this.epgService = epgService;
        this.streamService = streamService;
        this.clock = clock;
    }

    public StreamInfo getCatchupStreamByTime(String channelId, long startEpochSecond, long endEpochSecond) {
        if (endEpochSecond < startEpochSecond) {
            throw new BusinessException("INVALID_TIME_RANGE", "End of the time window precedes its start",
                    HttpStatus.BAD_REQUEST);
        }
        Program program = epgService.findProgramByTime(channelId, startEpochSecond, endEpochSecond);
        if (program == null) {
            throw BusinessException.notFound("No programme on channel " + channelId + " in the requested window");
        }
        log.debug("Catch-up on channel {} resolved to schedule {}", channelId, program.getScheduleId());
        return streamService.getCatchupStream(program.getScheduleId());
    }

    public CatchupAvailability getCatchupAvailability(String channelId) {
        List<Program> programs = epgService.getEpg(channelId, ARCHIVE_DAYS, 0).programsOf(channelId);
        if (programs.isEmpty()) {
            return new CatchupAvailability(false, 0d, 0);
        }
        long oldest = Long.MAX_VALUE;
        for (Program program : programs) {
            oldest = Math.min(oldest, program.getStartTimeUtc());
        }
        double days = BigDecimal.valueOf((clock.millis() - oldest) / MILLIS_PER_DAY)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
        return new CatchupAvailability(true, days, programs.size());
    }
}
