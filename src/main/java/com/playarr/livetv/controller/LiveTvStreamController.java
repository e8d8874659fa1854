package com.playarr.livetv.controller;

import com.playarr.livetv.service.LiveTvService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * Target of the stream URLs written into generated playlists. Players cannot send headers, so the
 * user is identified by the api_key query parameter.
 */
@RestController
@RequestMapping("/api/livetv")
@Tag(name = "Live TV", description = "Channels, guide and playlist produced by the last live TV sync")
public class LiveTvStreamController extends BaseController {

    private final LiveTvService liveTvService;

    public LiveTvStreamController(LiveTvService liveTvService) {
        this.liveTvService = liveTvService;
    }

    @GetMapping("/stream/{channelId}")
    @Operation(summary = "Open a channel stream", description = "Redirects to the upstream stream URL.")
    public ResponseEntity<Void> stream(
            @Parameter(description = "Channel ID (tvg-id)") @PathVariable String channelId,
            @Parameter(description = "The user's API key") @RequestParam(name = "api_key") String apiKey) {
        String streamUrl = liveTvService.resolveStreamUrl(apiKey, channelId);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(streamUrl))
                .build();
    }
}
