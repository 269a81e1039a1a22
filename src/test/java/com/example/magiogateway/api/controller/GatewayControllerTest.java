package com.example.magiogateway.api.controller;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.magiogateway.api.response.AuthStatusResponse;
import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.application.service.CatchupService;
import com.example.magiogateway.application.service.ChannelService;
import com.example.magiogateway.application.service.DeviceService;
import com.example.magiogateway.application.service.EpgService;
import com.example.magiogateway.application.service.MagioAuthService;
import com.example.magiogateway.application.service.StreamService;
import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.common.exception.GlobalExceptionHandler;
import com.example.magiogateway.domain.model.AuthError;
import com.example.magiogateway.domain.model.AuthResult;
import com.example.magiogateway.domain.model.AuthState;
import com.example.magiogateway.domain.model.CatchupAvailability;
import com.example.magiogateway.domain.model.Channel;
import com.example.magiogateway.domain.model.Device;
import com.example.magiogateway.domain.model.DeviceCount;
import com.example.magiogateway.domain.model.DeviceType;
import com.example.magiogateway.domain.model.Program;
import com.example.magiogateway.domain.model.StreamInfo;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class GatewayControllerTest {

    private MagioAuthService authService;
    private ChannelService channelService;
    private StreamService streamService;
    private CatchupService catchupService;
    private EpgService epgService;
    private DeviceService deviceService;
    private TtlCache cache;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        authService = mock(MagioAuthService.class);
        channelService = mock(ChannelService.class);
        streamService = mock(StreamService.class);
        catchupService = mock(CatchupService.class);
        epgService = mock(EpgService.class);
        deviceService = mock(DeviceService.class);
        cache = new TtlCache(new AppCacheProperties());

        mockMvc = MockMvcBuilders.standaloneSetup(
                        new AuthController(authService),
                        new CacheController(cache),
                        new ChannelController(channelService),
                        new StreamController(streamService, catchupService),
                        new EpgController(epgService),
                        new DeviceController(deviceService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void statusShouldReturnEnvelope() throws Exception {
        AuthStatusResponse status = new AuthStatusResponse();
        status.setAuthenticated(true);
        status.setLanguage("cz");
        status.setTokenExpiresIn(3600L);
        status.setState(AuthState.VALID);
        when(authService.getAuthStatus()).thenReturn(status);

        mockMvc.perform(get("/api/v1/auth/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0"))
                .andExpect(jsonPath("$.data.authenticated").value(true))
                .andExpect(jsonPath("$.data.token_expires_in").value(3600))
                .andExpect(jsonPath("$.data.state").value("VALID"));
    }

    @Test
    void loginFailureShouldMapToUnauthorized() throws Exception {
        when(authService.login()).thenReturn(AuthResult.failure(AuthError.CONFIG_ERROR, "Username or password is not configured"));

        mockMvc.perform(post("/api/v1/auth/login"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("MAGIO_CONFIG_ERROR"))
                .andExpect(jsonPath("$.message").value("Username or password is not configured"));
    }

    @Test
    void logoutShouldReportFailedRecordRemoval() throws Exception {
        when(authService.logout()).thenReturn(false);

        mockMvc.perform(post("/api/v1/auth/logout"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("TOKEN_DELETE_FAILED"));
    }

    @Test
    void cacheEndpointsShouldClearByPrefix() throws Exception {
        cache.store("channel_cz_1", "a");
        cache.store("channel_cz_2", "b");
        cache.store("channel_sk_1", "c");

        mockMvc.perform(delete("/api/v1/cache").param("key", "channel_cz_*"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(2));
        mockMvc.perform(get("/api/v1/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalEntries").value(1))
                .andExpect(jsonPath("$.data.keys[0]").value("channel_sk_1"));
    }

    @Test
    void blankCacheKeyShouldClearEverything() throws Exception {
        cache.store("channels_cz", "list");
        cache.store("stream_cz_1_p5", "url");

        mockMvc.perform(delete("/api/v1/cache").param("key", ""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(2));
        mockMvc.perform(delete("/api/v1/cache").param("key", "   "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(0));
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void unknownChannelShouldReturnNotFound() throws Exception {
        when(channelService.getChannel("999")).thenReturn(null);

        mockMvc.perform(get("/api/v1/channels/999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void channelQueryShouldSearch() throws Exception {
        when(channelService.searchChannels("sport")).thenReturn(Collections.singletonList(
                new Channel("3", "Sport 1", "Sport 1", "", "Sport", false)));

        mockMvc.perform(get("/api/v1/channels").param("q", "sport"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("3"))
                .andExpect(jsonPath("$.data[0].group").value("Sport"));
    }

    @Test
    void liveStreamShouldRedirectWhenAsked() throws Exception {
        when(streamService.getLiveStream(42L)).thenReturn(new StreamInfo("https://cdn.example.net/live/42.m3u8",
                Collections.singletonMap("Host", "cdn.example.net"), StreamInfo.DEFAULT_CONTENT_TYPE, true));

        mockMvc.perform(get("/api/v1/streams/live/42").param("redirect", "true"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://cdn.example.net/live/42.m3u8"));
        mockMvc.perform(get("/api/v1/streams/live/42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.url").value("https://cdn.example.net/live/42.m3u8"))
                .andExpect(jsonPath("$.data.live").value(true));
    }

    @Test
    void upstreamFailureShouldMapToBadGateway() throws Exception {
        when(streamService.getCatchupStream(7L)).thenThrow(BusinessException.upstream("Failed to resolve stream"));

        mockMvc.perform(get("/api/v1/streams/catchup/7"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("MAGIO_UPSTREAM_ERROR"));
    }

    @Test
    void nonNumericStreamIdShouldBeRejected() throws Exception {
        mockMvc.perform(get("/api/v1/streams/live/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void catchupByTimeShouldRedirectToArchiveStream() throws Exception {
        when(catchupService.getCatchupStreamByTime("1", 1767268800L, 1767269400L)).thenReturn(new StreamInfo(
                "https://cdn.example.net/archive/102.m3u8", Collections.<String, String>emptyMap(),
                StreamInfo.DEFAULT_CONTENT_TYPE, false));

        mockMvc.perform(get("/api/v1/streams/catchup/channel/1")
                        .param("start", "1767268800").param("end", "1767269400").param("redirect", "true"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://cdn.example.net/archive/102.m3u8"));
    }

    @Test
    void catchupAvailabilityShouldReturnEnvelope() throws Exception {
        when(catchupService.getCatchupAvailability("1")).thenReturn(new CatchupAvailability(true, 6.3d, 42));

        mockMvc.perform(get("/api/v1/streams/catchup/channel/1/availability"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.hasArchive").value(true))
                .andExpect(jsonPath("$.data.daysAvailable").value(6.3d))
                .andExpect(jsonPath("$.data.programsCount").value(42));
    }

    @Test
    void currentProgramShouldReturnNotFoundWhenNothingRuns() throws Exception {
        when(epgService.getCurrentProgram("1")).thenReturn(null);

        mockMvc.perform(get("/api/v1/epg/1/current"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void nextProgramsShouldPassCount() throws Exception {
        when(epgService.getNextPrograms("1", 2)).thenReturn(Collections.singletonList(new Program(104L, "Match",
                1767270600000L, 1767276000000L, "", 5400L, "Sport", null, null, Collections.<String>emptyList())));

        mockMvc.perform(get("/api/v1/epg/1/next").param("count", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].scheduleId").value(104))
                .andExpect(jsonPath("$.data[0].title").value("Match"));
    }

    @Test
    void guideShouldRejectNonNumericDays() throws Exception {
        mockMvc.perform(get("/api/v1/epg").param("daysBack", "week"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("400"));
    }

    @Test
    void devicesShouldListCountAndDelete() throws Exception {
        when(deviceService.getDevices()).thenReturn(Arrays.asList(
                new Device("d-1", "Android TV", DeviceType.CURRENT, true),
                new Device("d-2", "Pixel", DeviceType.MOBILE, false)));
        when(deviceService.getDeviceCount()).thenReturn(new DeviceCount(2, 1, 1, 0));

        mockMvc.perform(get("/api/v1/devices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].type").value("CURRENT"))
                .andExpect(jsonPath("$.data[0].thisDevice").value(true));
        mockMvc.perform(get("/api/v1/devices/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(2))
                .andExpect(jsonPath("$.data.mobile").value(1));
        mockMvc.perform(delete("/api/v1/devices/d-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0"));
        verify(deviceService).deleteDevice("d-2");
    }

    @Test
    void unknownDeviceAndRejectedDeletionShouldMapToErrors() throws Exception {
        when(deviceService.getDevice("d-9")).thenReturn(null);
        doThrow(BusinessException.upstream("Failed to delete device")).when(deviceService).deleteDevice("d-1");

        mockMvc.perform(get("/api/v1/devices/d-9"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/devices/d-1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("MAGIO_UPSTREAM_ERROR"));
    }
}
