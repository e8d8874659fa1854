package com.playarr.livetv.controller;

import com.playarr.livetv.dto.ChannelDTO;
import com.playarr.livetv.dto.ProgramDTO;
import com.playarr.livetv.exception.ResourceNotFoundException;
import com.playarr.livetv.parser.M3uPlaylistWriter;
import com.playarr.livetv.service.LiveTvService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/livetv/users/{username}")
@Tag(name = "Live TV", description = "Channels, guide and playlist produced by the last live TV sync")
public class LiveTvController extends BaseController {

    static final MediaType M3U_MEDIA_TYPE = MediaType.parseMediaType("audio/x-mpegurl");

    private final LiveTvService liveTvService;

    public LiveTvController(LiveTvService liveTvService) {
        this.liveTvService = liveTvService;
    }

    @GetMapping("/channels")
    @Operation(summary = "List a user's channels",
               description = "Returns every stored channel with the programme airing now, when the guide has one.")
    public ResponseEntity<List<ChannelDTO>> getChannels(
            @Parameter(description = "Username") @PathVariable String username) {
        return ResponseEntity.ok(liveTvService.getUserChannels(username));
    }

    @GetMapping("/channels/{channelId}")
    @Operation(summary = "Get one channel")
    public ResponseEntity<ChannelDTO> getChannel(
            @Parameter(description = "Username") @PathVariable String username,
            @Parameter(description = "Channel ID (tvg-id)") @PathVariable String channelId) {
        return ResponseEntity.ok(liveTvService.getChannel(username, channelId));
    }

    @GetMapping("/channels/{channelId}/programs")
    @Operation(summary = "Get a channel's guide", description = "Programmes ordered by start time.")
    public ResponseEntity<List<ProgramDTO>> getChannelPrograms(
            @Parameter(description = "Username") @PathVariable String username,
            @Parameter(description = "Channel ID (tvg-id)") @PathVariable String channelId) {
        return ResponseEntity.ok(liveTvService.getChannelPrograms(username, channelId));
    }

    @GetMapping("/m3u")
    @Operation(summary = "Download the rewritten playlist",
               description = "Stream URLs point back at this server; the given api_key is embedded in each of them.")
    public ResponseEntity<String> getPlaylist(
            @Parameter(description = "Username") @PathVariable String username,
            @Parameter(description = "Key embedded in the stream URLs") @RequestParam(name = "api_key", required = false) String apiKey) {
        String baseUrl = ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
        String playlist = liveTvService.getM3uPlaylist(username, baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            playlist = playlist.replace(M3uPlaylistWriter.API_KEY_PLACEHOLDER, apiKey);
        }
        return ResponseEntity.ok().contentType(M3U_MEDIA_TYPE).body(playlist);
    }

    @GetMapping("/epg")
    @Operation(summary = "Download the cached XMLTV guide")
    public ResponseEntity<Resource> getEpg(
            @Parameter(description = "Username") @PathVariable String username) {
        Path epg = liveTvService.getEpgPath(username)
                .orElseThrow(() -> new ResourceNotFoundException("No live TV guide for user " + username));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(new FileSystemResource(epg));
    }
}
