package com.example.magiogateway.api.controller;

import com.example.magiogateway.api.response.ApiResponse;
import com.example.magiogateway.application.service.CatchupService;
import com.example.magiogateway.application.service.StreamService;
import com.example.magiogateway.domain.model.CatchupAvailability;
import com.example.magiogateway.domain.model.StreamInfo;
import java.net.URI;
import javax.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/streams")
public class StreamController {

    private final StreamService streamService;
    private final CatchupService catchupService;

    public StreamController(StreamService streamService, CatchupService catchupService) {
        this.streamService = streamService;
        this.catchupService = catchupService;
    }

    @GetMapping("/live/{channelId}")
    public ResponseEntity<?> live(
            @PathVariable("channelId") @Min(1) long channelId,
            @RequestParam(value = "redirect", defaultValue = "false") boolean redirect) {
        return respond(streamService.getLiveStream(channelId), redirect);
    }

    @GetMapping("/catchup/{scheduleId}")
    public ResponseEntity<?> catchup(
            @PathVariable("scheduleId") @Min(1) long scheduleId,
            @RequestParam(value = "redirect", defaultValue = "false") boolean redirect) {
        return respond(streamService.getCatchupStream(scheduleId), redirect);
    }

    @GetMapping("/catchup/channel/{channelId}")
    public ResponseEntity<?> catchupByTime(
            @PathVariable("channelId") String channelId,
            @RequestParam("start") @Min(0) long start,
            @RequestParam("end") @Min(0) long end,
            @RequestParam(value = "redirect", defaultValue = "false") boolean redirect) {
        return respond(catchupService.getCatchupStreamByTime(channelId, start, end), redirect);
    }

    @GetMapping("/catchup/channel/{channelId}/availability")
    public ApiResponse<CatchupAvailability> catchupAvailability(@PathVariable("channelId") String channelId) {
        return ApiResponse.success(catchupService.getCatchupAvailability(channelId));
    }

    private ResponseEntity<?> respond(StreamInfo stream, boolean redirect) {
        if (redirect) {
            return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(stream.getUrl())).build();
        }
        return ResponseEntity.ok(ApiResponse.success(stream));
    }
}
