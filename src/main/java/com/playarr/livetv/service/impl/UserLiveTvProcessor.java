package com.playarr.livetv.service.impl;

import com.playarr.livetv.cache.LiveTvCacheStore;
import com.playarr.livetv.exception.CacheException;
import com.playarr.livetv.exception.ConfigCorruptException;
import com.playarr.livetv.exception.PlaylistParseException;
import com.playarr.livetv.exception.SyncCancelledException;
import com.playarr.livetv.model.Channel;
import com.playarr.livetv.model.LiveTvConfig;
import com.playarr.livetv.model.Program;
import com.playarr.livetv.model.User;
import com.playarr.livetv.parser.M3uParser;
import com.playarr.livetv.parser.xmltv.EpgParser;
import com.playarr.livetv.service.CoalescedUpstream;
import com.playarr.livetv.service.UserProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns one user's already fetched playlist and guide into owned channel and programme records.
 *
 * Writes the user's cache files and runs the parsers. It never touches the database; the
 * orchestrator persists whatever this returns.
 */
@Service
public class UserLiveTvProcessor {

    private static final Logger logger = LoggerFactory.getLogger(UserLiveTvProcessor.class);

    static final String M3U_FETCH_FAILED = "Failed to fetch M3U content";
    static final String M3U_PARSE_FAILED = "Failed to parse M3U content";

    private final LiveTvCacheStore cacheStore;
    private final M3uParser m3uParser;
    private final EpgParser epgParser;
    private final Clock clock;

    public UserLiveTvProcessor(LiveTvCacheStore cacheStore, M3uParser m3uParser, EpgParser epgParser) {
        this(cacheStore, m3uParser, epgParser, Clock.systemUTC());
    }

    /**
     * Constructor for testing with a fixed clock.
     */
    UserLiveTvProcessor(LiveTvCacheStore cacheStore, M3uParser m3uParser, EpgParser epgParser, Clock clock) {
        this.cacheStore = cacheStore;
        this.m3uParser = m3uParser;
        this.epgParser = epgParser;
        this.clock = clock;
    }

    /**
     * @param user the user being synced
     * @param m3u  the fetched playlist entry for the user's m3u_url, or null if none was fetched
     * @param epg  the fetched guide entry for the user's epg_url, or null when the user has no guide
     * @throws ConfigCorruptException if the user's liveTV object has no m3u_url key
     * @throws SyncCancelledException if the sync is cancelled while this user is processed
     */
    public UserProcessingResult process(User user, CoalescedUpstream m3u, CoalescedUpstream epg) {
        String username = user.getUsername();
        LiveTvConfig config = user.getLiveTvConfig();
        if (config.isCorrupt()) {
            throw ConfigCorruptException.missingM3uUrl(username);
        }
        checkCancelled(username);

        if (m3u == null || !m3u.isFetched() || m3u.getContent() == null) {
            logger.warn("No playlist content for {}: {}", username,
                    m3u != null && m3u.getFailure() != null ? m3u.getFailure().getMessage() : "not fetched");
            return UserProcessingResult.failure(username, M3U_FETCH_FAILED);
        }

        try {
            cacheStore.writeM3u(username, m3u.getContent());
        } catch (CacheException e) {
            logger.error("Could not cache playlist for {}, continuing with parsed channels", username, e);
        }

        List<Channel> parsedChannels;
        try {
            parsedChannels = m3uParser.parse(m3u.getContent());
        } catch (PlaylistParseException e) {
            logger.error("Playlist for {} could not be parsed: {}", username, e.getMessage());
            return UserProcessingResult.failure(username, M3U_PARSE_FAILED);
        }

        Instant now = clock.instant();
        List<Channel> channels = ownChannels(username, parsedChannels, now);
        List<Program> programs = config.hasEpg() ? processEpg(username, epg, now) : List.of();

        logger.info("Processed live TV for {}: {} channels, {} programs", username, channels.size(), programs.size());
        return UserProcessingResult.success(username, channels, programs);
    }

    private List<Channel> ownChannels(String username, List<Channel> parsed, Instant now) {
        Set<String> seenIds = new HashSet<>();
        List<Channel> owned = new ArrayList<>(parsed.size());
        int duplicates = 0;

        for (Channel channel : parsed) {
            // the table key is (username, channel_id), so a repeated tvg-id can only be stored once
            if (!seenIds.add(channel.getChannelId())) {
                duplicates++;
                continue;
            }
            owned.add(channel.forUser(username, now));
        }

        if (duplicates > 0) {
            logger.info("Dropped {} channels with repeated ids from {}'s playlist", duplicates, username);
        }
        return owned;
    }

    private List<Program> processEpg(String username, CoalescedUpstream epg, Instant now) {
        if (epg == null || !epg.isFetched()) {
            logger.warn("EPG for {} unavailable ({}), keeping channels without programs", username,
                    epg != null && epg.getFailure() != null ? epg.getFailure().getMessage() : "not fetched");
            return List.of();
        }

        try {
            Path epgFile = epg.getSharedFile() != null
                    ? cacheStore.copyEpg(username, epg.getSharedFile())
                    : cacheStore.writeEpg(username, epg.getContent());

            checkCancelled(username);
            List<Program> parsed = epgParser.parse(epgFile);

            List<Program> owned = new ArrayList<>(parsed.size());
            for (Program program : parsed) {
                owned.add(program.forUser(username, now));
            }
            return owned;

        } catch (SyncCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("EPG processing failed for {}, keeping channels without programs: {}",
                    username, e.getMessage(), e);
            return List.of();
        }
    }

    private void checkCancelled(String username) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SyncCancelledException("Sync cancelled while processing " + username);
        }
    }
}
