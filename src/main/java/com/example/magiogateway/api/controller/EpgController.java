package com.example.magiogateway.api.controller;

import com.example.magiogateway.api.response.ApiResponse;
import com.example.magiogateway.application.service.EpgService;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.EpgGuide;
import com.example.magiogateway.domain.model.Program;
import java.util.List;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/epg")
public class EpgController {

    private final EpgService epgService;

    public EpgController(EpgService epgService) {
        this.epgService = epgService;
    }

    @GetMapping
    public ApiResponse<EpgGuide> guide(
            @RequestParam(value = "channelId", required = false) String channelId,
            @RequestParam(value = "daysBack", defaultValue = "1") @Min(0) @Max(7) int daysBack,
            @RequestParam(value = "daysForward", defaultValue = "1") @Min(0) @Max(7) int daysForward) {
        return ApiResponse.success(epgService.getEpg(channelId, daysBack, daysForward));
    }

    @GetMapping("/{channelId}/current")
    public ApiResponse<Program> current(@PathVariable("channelId") String channelId) {
        return found(epgService.getCurrentProgram(channelId), "No programme is running on channel " + channelId);
    }

    @GetMapping("/{channelId}/next")
    public ApiResponse<List<Program>> next(
            @PathVariable("channelId") String channelId,
            @RequestParam(value = "count", defaultValue = "5") @Min(1) @Max(50) int count) {
        return ApiResponse.success(epgService.getNextPrograms(channelId, count));
    }

    @GetMapping("/{channelId}/find")
    public ApiResponse<Program> find(
            @PathVariable("channelId") String channelId,
            @RequestParam("start") long start,
            @RequestParam("end") long end) {
        return found(epgService.findProgramByTime(channelId, start, end),
                "No programme on channel " + channelId + " in the requested window");
    }

    @DeleteMapping("/cache")
    public ApiResponse<Integer> clearCache() {
        return ApiResponse.success(epgService.clearCache());
    }

    private ApiResponse<Program> found(Program program, String message) {
        if (program == null) {
            throw BusinessException.notFound(message);
        }
        return ApiResponse.success(program);
    }
}
