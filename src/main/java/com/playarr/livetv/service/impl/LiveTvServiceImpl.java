package com.playarr.livetv.service.impl;

import com.playarr.livetv.cache.LiveTvCacheStore;
import com.playarr.livetv.config.CacheConfig;
import com.playarr.livetv.dto.ChannelDTO;
import com.playarr.livetv.dto.ProgramDTO;
import com.playarr.livetv.exception.ResourceNotFoundException;
import com.playarr.livetv.exception.UnauthorizedException;
import com.playarr.livetv.model.Channel;
import com.playarr.livetv.model.Program;
import com.playarr.livetv.parser.M3uParser;
import com.playarr.livetv.parser.M3uPlaylistWriter;
import com.playarr.livetv.repository.ChannelRepository;
import com.playarr.livetv.repository.ProgramRepository;
import com.playarr.livetv.repository.UserRepository;
import com.playarr.livetv.service.LiveTvService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class LiveTvServiceImpl implements LiveTvService {

    private static final Logger logger = LoggerFactory.getLogger(LiveTvServiceImpl.class);

    private final UserRepository userRepository;
    private final ChannelRepository channelRepository;
    private final ProgramRepository programRepository;
    private final LiveTvCacheStore cacheStore;
    private final M3uParser m3uParser;
    private final M3uPlaylistWriter playlistWriter;
    private final Clock clock;

    @Autowired
    public LiveTvServiceImpl(UserRepository userRepository,
                             ChannelRepository channelRepository,
                             ProgramRepository programRepository,
                             LiveTvCacheStore cacheStore,
                             M3uParser m3uParser,
                             M3uPlaylistWriter playlistWriter) {
        this(userRepository, channelRepository, programRepository, cacheStore, m3uParser, playlistWriter, Clock.systemUTC());
    }

    /**
     * Constructor for testing with a fixed clock.
     */
    LiveTvServiceImpl(UserRepository userRepository,
                      ChannelRepository channelRepository,
                      ProgramRepository programRepository,
                      LiveTvCacheStore cacheStore,
                      M3uParser m3uParser,
                      M3uPlaylistWriter playlistWriter,
                      Clock clock) {
        this.userRepository = userRepository;
        this.channelRepository = channelRepository;
        this.programRepository = programRepository;
        this.cacheStore = cacheStore;
        this.m3uParser = m3uParser;
        this.playlistWriter = playlistWriter;
        this.clock = clock;
    }

    @Override
    public List<ChannelDTO> getUserChannels(String username) {
        List<Channel> channels = channelRepository.findByUsername(username);
        if (channels.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        Map<String, Program> currentByChannel = new HashMap<>();
        for (Program program : programRepository.findCurrent(username, now)) {
            // overlapping guide entries: keep the earliest, which is the first in sort-key order
            currentByChannel.putIfAbsent(program.getChannelId(), program);
        }

        return channels.stream()
                .map(channel -> {
                    Program current = currentByChannel.get(channel.getChannelId());
                    return ChannelDTO.from(channel, current != null ? ProgramDTO.from(current) : null);
                })
                .collect(Collectors.toList());
    }

    @Override
    public ChannelDTO getChannel(String username, String channelId) {
        Channel channel = channelRepository.findOne(username, channelId)
                .orElseThrow(() -> new ResourceNotFoundException("Channel not found: " + channelId));
        return ChannelDTO.from(channel, null);
    }

    @Override
    public List<ProgramDTO> getChannelPrograms(String username, String channelId) {
        return programRepository.findByUsernameAndChannel(username, channelId).stream()
                .map(ProgramDTO::from)
                .collect(Collectors.toList());
    }

    @Override
    public String resolveStreamUrl(String apiKey, String channelId) {
        String username = userRepository.findUsernameByApiKey(apiKey)
                .orElseThrow(() -> new UnauthorizedException("Invalid API key"));
        Channel channel = channelRepository.findOne(username, channelId)
                .orElseThrow(() -> new ResourceNotFoundException("Channel not found: " + channelId));
        return channel.getUrl();
    }

    @Override
    @Cacheable(value = CacheConfig.PLAYLIST_CACHE, key = "#username + '|' + #baseUrl")
    public String getM3uPlaylist(String username, String baseUrl) {
        String cached = cacheStore.readM3u(username)
                .orElseThrow(() -> new ResourceNotFoundException("No live TV playlist for user " + username));

        List<Channel> channels = m3uParser.parse(cached);
        logger.debug("Rewriting playlist for {} with {} channels", username, channels.size());
        return playlistWriter.write(channels, baseUrl);
    }

    @Override
    public Optional<Path> getEpgPath(String username) {
        return cacheStore.getEpgPath(username);
    }
}
