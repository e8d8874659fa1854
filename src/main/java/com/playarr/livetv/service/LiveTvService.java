package com.playarr.livetv.service;

import com.playarr.livetv.dto.ChannelDTO;
import com.playarr.livetv.dto.ProgramDTO;
import com.playarr.livetv.exception.ResourceNotFoundException;
import com.playarr.livetv.exception.UnauthorizedException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Read side of live TV: what the last sync stored for a user.
 */
public interface LiveTvService {

    /**
     * All channels of a user, each with the programme airing now if the guide has one.
     */
    List<ChannelDTO> getUserChannels(String username);

    /**
     * @throws ResourceNotFoundException if the user has no such channel
     */
    ChannelDTO getChannel(String username, String channelId);

    List<ProgramDTO> getChannelPrograms(String username, String channelId);

    /**
     * Upstream stream URL of a channel, for the user owning the API key embedded in playlist URLs.
     *
     * @throws UnauthorizedException if the key belongs to no user
     * @throws ResourceNotFoundException if that user has no such channel
     */
    String resolveStreamUrl(String apiKey, String channelId);

    /**
     * The user's cached playlist with every stream URL pointing back at this server. The URLs carry an
     * {@code {API_KEY}} placeholder for the caller to substitute.
     *
     * @throws ResourceNotFoundException if no playlist has been cached for the user
     */
    String getM3uPlaylist(String username, String baseUrl);

    Optional<Path> getEpgPath(String username);
}
