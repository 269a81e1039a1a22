package com.example.magiogateway.application.service;

import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.config.AppHttpProperties;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.AuthHeaders;
import com.example.magiogateway.domain.model.Channel;
import com.example.magiogateway.infrastructure.magio.MagioApiClient;
import com.example.magiogateway.infrastructure.magio.MagioApiException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ChannelService {

    private static final Logger log = LoggerFactory.getLogger(ChannelService.class);

    private final MagioAuthService authService;
    private final MagioApiClient apiClient;
    private final TtlCache cache;
    private final AppCacheProperties cacheProperties;
    private final AppHttpProperties httpProperties;

    public ChannelService(MagioAuthService authService,
                          MagioApiClient apiClient,
                          TtlCache cache,
                          AppCacheProperties cacheProperties,
                          AppHttpProperties httpProperties) {
        this.authService = authService;
        this.apiClient = apiClient;
        this.cache = cache;
        this.cacheProperties = cacheProperties;
        this.httpProperties = httpProperties;
    }

    public List<Channel> getChannels() {
        return cache.getOrFetch("channels_" + authService.getLanguage(), List.class, this::fetchChannels,
                cacheProperties.getChannelTtlSeconds());
    }

    /**
     * @return the channel, or {@code null} when the account has no channel with this id
     */
    public Channel getChannel(String channelId) {
        String key = "channel_" + authService.getLanguage() + "_" + channelId;
        return cache.getOrFetch(key, Channel.class, () -> findChannel(channelId), cacheProperties.getChannelTtlSeconds());
    }

    public List<String> getChannelGroups() {
        String key = "channel_groups_" + authService.getLanguage();
        return cache.getOrFetch(key, List.class, () -> {
            Set<String> groups = new TreeSet<>();
            for (Channel channel : getChannels()) {
                groups.add(channel.getGroup());
            }
            return Collections.unmodifiableList(new ArrayList<>(groups));
        }, cacheProperties.getChannelTtlSeconds());
    }

    public List<Channel> getChannelsByGroup(String group) {
        String normalized = group.trim().toLowerCase(Locale.ROOT);
        String key = "channels_group_" + authService.getLanguage() + "_" + normalized;
        return cache.getOrFetch(key, List.class, () -> getChannels().stream()
                        .filter(channel -> channel.getGroup().toLowerCase(Locale.ROOT).equals(normalized))
                        .collect(Collectors.toList()),
                cacheProperties.getChannelTtlSeconds());
    }

    /**
     * Case-insensitive match on name or original name. Results are not cached; the channel list
     * they are computed from is.
     */
    public List<Channel> searchChannels(String term) {
        if (!StringUtils.hasText(term)) {
            return Collections.emptyList();
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        return getChannels().stream()
                .filter(channel -> contains(channel.getName(), needle) || contains(channel.getOriginalName(), needle))
                .collect(Collectors.toList());
    }

    public int clearCache() {
        String language = authService.getLanguage();
        int removed = cache.clear("channels_" + language)
                + cache.clear("channel_groups_" + language)
                + cache.clear("channel_" + language + "_*")
                + cache.clear("channels_group_" + language + "_*");
        log.info("Channel cache cleared, removed {} entries", removed);
        return removed;
    }

    // --- Private methods ---

    private Channel findChannel(String channelId) {
        for (Channel channel : getChannels()) {
            if (channel.getId().equals(channelId)) {
                return channel;
            }
        }
        log.warn("Channel {} not found", channelId);
        return null;
    }

    private List<Channel> fetchChannels() {
        AuthHeaders headers = authService.getAuthHeaders();
        if (headers == null) {
            throw BusinessException.unauthorized("Cannot load channels: not authenticated with Magio");
        }
        String language = authService.getLanguage();
        try {
            Map<String, String> categoryParams = new HashMap<>();
            categoryParams.put("language", language);
            JsonNode categories = apiClient.getJson(MagioApiClient.PATH_CATEGORIES, categoryParams,
                    headers.toMap(), httpProperties.getApiTimeoutMs());
            Map<String, String> groupByChannel = new HashMap<>();
            for (JsonNode category : categories.path("categories")) {
                String groupName = category.path("name").asText(Channel.DEFAULT_GROUP);
                for (JsonNode channel : category.path("channels")) {
                    groupByChannel.put(channel.path("channelId").asText(), groupName);
                }
            }

            Map<String, String> channelParams = new LinkedHashMap<>();
            channelParams.put("list", "LIVE");
            channelParams.put("queryScope", "LIVE");
            JsonNode response = apiClient.getJson(MagioApiClient.PATH_CHANNELS, channelParams,
                    headers.toMap(), httpProperties.getApiTimeoutMs());

            List<Channel> channels = new ArrayList<>();
            for (JsonNode item : response.path("items")) {
                JsonNode node = item.path("channel");
                String id = node.path("channelId").asText(null);
                if (id == null) {
                    continue;
                }
                String name = node.path("name").asText("");
                String originalName = node.path("originalName").asText("");
                channels.add(new Channel(
                        id,
                        name,
                        originalName.isEmpty() ? name : originalName,
                        node.path("logoUrl").asText(""),
                        groupByChannel.getOrDefault(id, Channel.DEFAULT_GROUP),
                        node.path("hasArchive").asBoolean(false)));
            }
            log.info("Loaded {} channels for {}", channels.size(), language);
            return Collections.unmodifiableList(channels);
        } catch (MagioApiException e) {
            log.error("Failed to load channels: {}", e.getMessage());
            throw BusinessException.upstream("Failed to load channels: " + e.getMessage());
        }
    }

    private boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
