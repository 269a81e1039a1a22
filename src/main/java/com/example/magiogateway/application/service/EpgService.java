package com.example.magiogateway.application.service;

import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.config.AppHttpProperties;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.AuthHeaders;
import com.example.magiogateway.domain.model.Channel;
import com.example.magiogateway.domain.model.EpgGuide;
import com.example.magiogateway.domain.model.Program;
import com.example.magiogateway.infrastructure.magio.MagioApiClient;
import com.example.magiogateway.infrastructure.magio.MagioApiException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Programme guide backed by {@code /v2/television/epg}.
 * <p>
 * Guide windows are whole UTC days: from midnight {@code daysBack} days ago to the last second
 * of the day {@code daysForward} days ahead. Time lookups query the exact window and are not
 * cached.
 */
@Service
public class EpgService {

    private static final Logger log = LoggerFactory.getLogger(EpgService.class);

    private static final DateTimeFormatter DAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter INSTANT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'.000Z'").withZone(ZoneOffset.UTC);

    private static final int GUIDE_LIMIT = 1000;
    private static final int LOOKUP_LIMIT = 10;
    private static final Duration CURRENT_PROGRAM_WINDOW = Duration.ofHours(3);

    private final MagioAuthService authService;
    private final ChannelService channelService;
    private final MagioApiClient apiClient;
    private final TtlCache cache;
    private final AppCacheProperties cacheProperties;
    private final AppHttpProperties httpProperties;
    private final Clock clock;

    @Autowired
    public EpgService(MagioAuthService authService,
                      ChannelService channelService,
                      MagioApiClient apiClient,
                      TtlCache cache,
                      AppCacheProperties cacheProperties,
                      AppHttpProperties httpProperties) {
        this(authService, channelService, apiClient, cache, cacheProperties, httpProperties, Clock.systemUTC());
    }

    EpgService(MagioAuthService authService,
               ChannelService channelService,
               MagioApiClient apiClient,
               TtlCache cache,
               AppCacheProperties cacheProperties,
               AppHttpProperties httpProperties,
               Clock clock) {
        this.authService = authService;
        this.channelService = channelService;
        this.apiClient = apiClient;
        this.cache = cache;
        this.cacheProperties = cacheProperties;
        this.httpProperties = httpProperties;
        this.clock = clock;
    }

    /**
     * @param channelId one channel, or {@code null} for every channel of the account
     */
    public EpgGuide getEpg(String channelId, int daysBack, int daysForward) {
        String key = "epg_" + authService.getLanguage() + "_" + (channelId == null ? "all" : channelId)
                + "_" + daysBack + "_" + daysForward;
        EpgGuide guide = cache.getOrFetch(key, EpgGuide.class,
                () -> fetchGuide(channelId, daysBack, daysForward), cacheProperties.getEpgTtlSeconds());
        return guide == null ? new EpgGuide() : guide;
    }

    /**
     * First programme of the channel overlapping {@code [startEpochSecond, endEpochSecond]}.
     *
     * @return the programme, or {@code null} when none matches
     */
    public Program findProgramByTime(String channelId, long startEpochSecond, long endEpochSecond) {
        long fromMillis = startEpochSecond * 1000L;
        long toMillis = endEpochSecond * 1000L;
        for (Program program : queryPrograms(channelId, fromMillis, toMillis)) {
            if (program.overlaps(fromMillis, toMillis)) {
                return program;
            }
        }
        log.debug("No programme on channel {} between {} and {}", channelId, startEpochSecond, endEpochSecond);
        return null;
    }

    public Program getCurrentProgram(String channelId) {
        long now = clock.millis();
        long window = CURRENT_PROGRAM_WINDOW.toMillis();
        for (Program program : queryPrograms(channelId, now - window, now + window)) {
            if (program.overlaps(now, now)) {
                return program;
            }
        }
        log.warn("Current programme for channel {} not found", channelId);
        return null;
    }

    public List<Program> getNextPrograms(String channelId, int count) {
        long now = clock.millis();
        return getEpg(channelId, 0, 1).programsOf(channelId).stream()
                .filter(program -> program.getStartTimeUtc() > now)
                .sorted(Comparator.comparingLong(Program::getStartTimeUtc))
                .limit(count)
                .collect(Collectors.toList());
    }

    public int clearCache() {
        int removed = cache.clear("epg_" + authService.getLanguage() + "_*");
        log.info("EPG cache cleared, removed {} entries", removed);
        return removed;
    }

    // --- Private methods ---

    private EpgGuide fetchGuide(String channelId, int daysBack, int daysForward) {
        String channelFilter;
        if (channelId != null) {
            channelFilter = "channel.id==" + channelId;
        } else {
            List<Channel> channels = channelService.getChannels();
            if (channels.isEmpty()) {
                log.warn("No channels available, EPG not loaded");
                return null;
            }
            channelFilter = "channel.id=in=(" + channels.stream().map(Channel::getId)
                    .collect(Collectors.joining(",")) + ")";
        }
        Instant now = clock.instant();
        String from = DAY_FORMAT.format(now.minus(Duration.ofDays(daysBack))) + "T00:00:00.000Z";
        String to = DAY_FORMAT.format(now.plus(Duration.ofDays(daysForward))) + "T23:59:59.000Z";
        JsonNode body = requestGuide(channelFilter, from, to, GUIDE_LIMIT);

        EpgGuide guide = new EpgGuide(new LinkedHashMap<>());
        for (JsonNode item : body.path("items")) {
            String id = item.path("channel").path("id").asText(null);
            if (id == null) {
                continue;
            }
            guide.getChannels().put(id, parsePrograms(item.path("programs")));
        }
        log.info("Loaded EPG for {} channels ({} programmes)", guide.getChannels().size(), guide.programCount());
        return guide;
    }

    private List<Program> queryPrograms(String channelId, long fromMillis, long toMillis) {
        JsonNode body = requestGuide("channel.id==" + channelId,
                INSTANT_FORMAT.format(Instant.ofEpochMilli(fromMillis)),
                INSTANT_FORMAT.format(Instant.ofEpochMilli(toMillis)), LOOKUP_LIMIT);
        List<Program> programs = new ArrayList<>();
        for (JsonNode item : body.path("items")) {
            programs.addAll(parsePrograms(item.path("programs")));
        }
        return programs;
    }

    private JsonNode requestGuide(String channelFilter, String from, String to, int limit) {
        AuthHeaders headers = authService.getAuthHeaders();
        if (headers == null) {
            throw BusinessException.unauthorized("Cannot load EPG: not authenticated with Magio");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filter", channelFilter + " and startTime=ge=" + from + " and endTime=le=" + to);
        params.put("limit", String.valueOf(limit));
        params.put("offset", "0");
        params.put("lang", authService.getLanguage().toUpperCase(Locale.ROOT));
        try {
            return apiClient.getJson(MagioApiClient.PATH_EPG, params, headers.toMap(), httpProperties.getApiTimeoutMs());
        } catch (MagioApiException e) {
            log.error("Failed to load EPG: {}", e.getMessage());
            throw BusinessException.upstream("Failed to load EPG: " + e.getMessage());
        }
    }

    private List<Program> parsePrograms(JsonNode nodes) {
        List<Program> programs = new ArrayList<>();
        for (JsonNode node : nodes) {
            long start = node.path("startTimeUTC").asLong();
            long end = node.path("endTimeUTC").asLong();
            JsonNode program = node.path("program");
            JsonNode value = program.path("programValue");
            List<String> images = new ArrayList<>();
            for (JsonNode image : program.path("images")) {
                images.add(image.asText());
            }
            programs.add(new Program(
                    node.path("scheduleId").asLong(),
                    program.path("title").asText(""),
                    start,
                    end,
                    program.path("description").asText(""),
                    (end - start) / 1000L,
                    program.path("programCategory").path("desc").asText(""),
                    value.hasNonNull("creationYear") ? Integer.valueOf(value.path("creationYear").asInt()) : null,
                    value.hasNonNull("episodeId") ? value.path("episodeId").asText() : null,
                    images));
        }
        return programs;
    }
}
