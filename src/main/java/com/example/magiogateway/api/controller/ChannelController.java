package com.example.magiogateway.api.controller;

import com.example.magiogateway.api.response.ApiResponse;
import com.example.magiogateway.application.service.ChannelService;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.Channel;
import java.util.List;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/channels")
public class ChannelController {

    private final ChannelService channelService;

    public ChannelController(ChannelService channelService) {
        this.channelService = channelService;
    }

    @GetMapping
    public ApiResponse<List<Channel>> listChannels(
            @RequestParam(value = "group", required = false) String group,
            @RequestParam(value = "q", required = false) String query) {
        if (StringUtils.hasText(query)) {
            return ApiResponse.success(channelService.searchChannels(query));
        }
        if (StringUtils.hasText(group)) {
            return ApiResponse.success(channelService.getChannelsByGroup(group));
        }
        return ApiResponse.success(channelService.getChannels());
    }

    @GetMapping("/groups")
    public ApiResponse<List<String>> listGroups() {
        return ApiResponse.success(channelService.getChannelGroups());
    }

    @GetMapping("/{id}")
    public ApiResponse<Channel> getChannel(@PathVariable("id") String id) {
        Channel channel = channelService.getChannel(id);
        if (channel == null) {
            throw BusinessException.notFound("Channel not found: " + id);
        }
        return ApiResponse.success(channel);
    }

    @DeleteMapping("/cache")
    public ApiResponse<Integer> clearCache() {
        return ApiResponse.success(channelService.clearCache());
    }
}
