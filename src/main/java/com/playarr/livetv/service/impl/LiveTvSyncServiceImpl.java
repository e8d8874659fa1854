package com.playarr.livetv.service.impl;

import com.playarr.livetv.cache.LiveTvCacheStore;
import com.playarr.livetv.client.FetchedPayload;
import com.playarr.livetv.client.UpstreamFetcher;
import com.playarr.livetv.config.CacheConfig;
import com.playarr.livetv.config.LiveTvProperties;
import com.playarr.livetv.dto.SyncResult;
import com.playarr.livetv.dto.UserSyncResult;
import com.playarr.livetv.exception.ConfigCorruptException;
import com.playarr.livetv.exception.RepositoryException;
import com.playarr.livetv.exception.SyncCancelledException;
import com.playarr.livetv.exception.UpstreamFetchException;
import com.playarr.livetv.model.Channel;
import com.playarr.livetv.model.LiveTvConfig;
import com.playarr.livetv.model.Program;
import com.playarr.livetv.model.User;
import com.playarr.livetv.repository.ChannelRepository;
import com.playarr.livetv.repository.ProgramRepository;
import com.playarr.livetv.repository.UserRepository;
import com.playarr.livetv.service.CoalescedUpstream;
import com.playarr.livetv.service.LiveTvSyncService;
import com.playarr.livetv.service.UserProcessingResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Implementation of LiveTvSyncService.
 *
 * Users sharing a URL share one download. Gzipped responses are decompressed once into a shared
 * file under the cache root and each subscriber gets a copy, because a response stream can only
 * be read once. Persistence happens only after every user has been processed: old records of the
 * successful users are deleted, then the new ones inserted, channels and programmes concurrently.
 */
@Service
public class LiveTvSyncServiceImpl implements LiveTvSyncService {

    private static final Logger logger = LoggerFactory.getLogger(LiveTvSyncServiceImpl.class);

    private final UserRepository userRepository;
    private final ChannelRepository channelRepository;
    private final ProgramRepository programRepository;
    private final UpstreamFetcher fetcher;
    private final UserLiveTvProcessor processor;
    private final LiveTvCacheStore cacheStore;
    private final CacheManager cacheManager;
    private final MeterRegistry meterRegistry;
    private final ExecutorService fetchExecutor;
    private final ExecutorService processingExecutor;
    private final boolean wipeDisabledUsers;

    @Autowired
    public LiveTvSyncServiceImpl(
            UserRepository userRepository,
            ChannelRepository channelRepository,
            ProgramRepository programRepository,
            UpstreamFetcher fetcher,
            UserLiveTvProcessor processor,
            LiveTvCacheStore cacheStore,
            CacheManager cacheManager,
            MeterRegistry meterRegistry,
            @Qualifier("upstreamFetchExecutor") ExecutorService fetchExecutor,
            @Qualifier("userProcessingExecutor") ExecutorService processingExecutor,
            LiveTvProperties properties) {
        this(userRepository, channelRepository, programRepository, fetcher, processor, cacheStore,
                cacheManager, meterRegistry, fetchExecutor, processingExecutor, properties.isWipeDisabledUsers());
    }

    /**
     * Package-private constructor for testing.
     */
    LiveTvSyncServiceImpl(
            UserRepository userRepository,
            ChannelRepository channelRepository,
            ProgramRepository programRepository,
            UpstreamFetcher fetcher,
            UserLiveTvProcessor processor,
            LiveTvCacheStore cacheStore,
            CacheManager cacheManager,
            MeterRegistry meterRegistry,
            ExecutorService fetchExecutor,
            ExecutorService processingExecutor,
            boolean wipeDisabledUsers) {
        this.userRepository = userRepository;
        this.channelRepository = channelRepository;
        this.programRepository = programRepository;
        this.fetcher = fetcher;
        this.processor = processor;
        this.cacheStore = cacheStore;
        this.cacheManager = cacheManager;
        this.meterRegistry = meterRegistry;
        this.fetchExecutor = fetchExecutor;
        this.processingExecutor = processingExecutor;
        this.wipeDisabledUsers = wipeDisabledUsers;
    }

    @Override
    public SyncResult syncAllUsers() {
        Timer.Sample timer = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        Map<String, CoalescedUpstream> epgByUrl = new LinkedHashMap<>();

        try {
            // 1. Load and classify users
            List<User> users = userRepository.findAllLiveTvConfigs();
            List<User> toProcess = new ArrayList<>();
            List<String> disabled = new ArrayList<>();
            for (User user : users) {
                LiveTvConfig config = user.getLiveTvConfig();
                if (config.isEligible() || config.isCorrupt()) {
                    toProcess.add(user);
                } else {
                    disabled.add(user.getUsername());
                }
            }
            meterRegistry.counter("livetv_sync_users", "outcome", "skipped").increment(disabled.size());

            if (toProcess.isEmpty() && !(wipeDisabledUsers && !disabled.isEmpty())) {
                logger.info("No users with live TV configured, nothing to sync");
                return finish(timer, "success", SyncResult.empty(System.currentTimeMillis() - startTime));
            }
            logger.info("Starting live TV sync: {} users to process, {} without live TV", toProcess.size(), disabled.size());

            // 2. Coalesce upstream URLs
            Map<String, CoalescedUpstream> m3uByUrl = new LinkedHashMap<>();
            for (User user : toProcess) {
                LiveTvConfig config = user.getLiveTvConfig();
                if (!config.isEligible()) {
                    continue;
                }
                m3uByUrl.computeIfAbsent(config.m3uUrl(), CoalescedUpstream::new).subscribe(user.getUsername());
                if (config.hasEpg()) {
                    epgByUrl.computeIfAbsent(config.epgUrl(), CoalescedUpstream::new).subscribe(user.getUsername());
                }
            }
            logger.info("Fetching {} unique playlists and {} unique guides", m3uByUrl.size(), epgByUrl.size());

            // 3-4. Fetch each unique URL once
            fetchAll(m3uByUrl.values(), "m3u");
            fetchAll(epgByUrl.values(), "epg");

            // 5. Per-user processing
            List<UserProcessingResult> processed = processAll(toProcess, m3uByUrl, epgByUrl);

            List<Channel> allChannels = new ArrayList<>();
            List<Program> allPrograms = new ArrayList<>();
            Set<String> syncedUsernames = new LinkedHashSet<>();
            List<UserSyncResult> results = new ArrayList<>();
            for (UserProcessingResult result : processed) {
                if (result.isSuccess()) {
                    allChannels.addAll(result.getChannels());
                    allPrograms.addAll(result.getPrograms());
                    syncedUsernames.add(result.getUsername());
                    results.add(UserSyncResult.success(
                            result.getUsername(), result.getChannels().size(), result.getPrograms().size()));
                    meterRegistry.counter("livetv_sync_users", "outcome", "success").increment();
                } else {
                    results.add(UserSyncResult.failure(result.getUsername(), result.getError()));
                    meterRegistry.counter("livetv_sync_users", "outcome", "failed").increment();
                }
            }
            if (wipeDisabledUsers) {
                syncedUsernames.addAll(disabled);
            }

            // 6. Bulk replace, unless cancelled first
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncCancelledException("Live TV sync cancelled before persistence");
            }
            persist(syncedUsernames, allChannels, allPrograms);
            evictPlaylists();

            SyncResult syncResult = new SyncResult(results, System.currentTimeMillis() - startTime);
            logger.info("Live TV sync completed: {} users processed, {} succeeded, {} channels and {} programs stored in {}ms",
                    syncResult.getUsersProcessed(), syncResult.countSuccessful(),
                    allChannels.size(), allPrograms.size(), syncResult.getDurationMs());
            return finish(timer, "success", syncResult);

        } catch (SyncCancelledException e) {
            logger.warn("Live TV sync cancelled after {}ms: {}", System.currentTimeMillis() - startTime, e.getMessage());
            finish(timer, "cancelled", null);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Live TV sync failed after {}ms", System.currentTimeMillis() - startTime, e);
            finish(timer, "error", null);
            throw e;
        } finally {
            for (CoalescedUpstream epg : epgByUrl.values()) {
                if (epg.getSharedFile() != null) {
                    cacheStore.deleteShared(epg.getSharedFile());
                }
            }
        }
    }

    private void fetchAll(Collection<CoalescedUpstream> entries, String kind) {
        List<Callable<Void>> tasks = new ArrayList<>(entries.size());
        for (CoalescedUpstream entry : entries) {
            tasks.add(() -> {
                fetchOne(entry, kind);
                return null;
            });
        }
        awaitAll(invokeAll(fetchExecutor, tasks));
    }

    private void fetchOne(CoalescedUpstream entry, String kind) {
        FetchedPayload payload = null;
        try {
            payload = fetcher.fetch(entry.getUrl());
            if (!payload.isGzipped()) {
                entry.completeWithContent(payload.getText());
            } else if ("epg".equals(kind)) {
                try (InputStream decompressed = payload.openStream()) {
                    entry.completeWithSharedFile(cacheStore.createSharedEpg(decompressed));
                }
            } else {
                try (InputStream decompressed = payload.openStream()) {
                    entry.completeWithContent(new String(decompressed.readAllBytes(), StandardCharsets.UTF_8));
                }
            }
            meterRegistry.counter("livetv_fetch_total", "kind", kind, "outcome", "success").increment();
            logger.debug("Fetched {} {} for {} users", kind, entry.getUrl(), entry.getSubscribers().size());

        } catch (SyncCancelledException e) {
            throw e;
        } catch (IOException e) {
            recordFetchFailure(entry, kind, UpstreamFetchException.network(entry.getUrl(), e));
        } catch (RuntimeException e) {
            recordFetchFailure(entry, kind, e);
        } finally {
            if (payload != null) {
                payload.discard();
            }
        }
    }

    private void recordFetchFailure(CoalescedUpstream entry, String kind, RuntimeException failure) {
        entry.fail(failure);
        meterRegistry.counter("livetv_fetch_total", "kind", kind, "outcome", "error").increment();
        logger.warn("Failed to fetch {} {} (subscribers: {}): {}",
                kind, entry.getUrl(), entry.getSubscribers(), failure.getMessage());
    }

    private List<UserProcessingResult> processAll(List<User> users,
                                                  Map<String, CoalescedUpstream> m3uByUrl,
                                                  Map<String, CoalescedUpstream> epgByUrl) {
        List<Callable<UserProcessingResult>> tasks = new ArrayList<>(users.size());
        for (User user : users) {
            LiveTvConfig config = user.getLiveTvConfig();
            CoalescedUpstream m3u = m3uByUrl.get(config.m3uUrl());
            CoalescedUpstream epg = config.hasEpg() ? epgByUrl.get(config.epgUrl()) : null;
            tasks.add(() -> processOne(user, m3u, epg));
        }
        return awaitAll(invokeAll(processingExecutor, tasks));
    }

    private UserProcessingResult processOne(User user, CoalescedUpstream m3u, CoalescedUpstream epg) {
        try {
            return processor.process(user, m3u, epg);
        } catch (ConfigCorruptException e) {
            logger.error("Live TV configuration for {} is corrupted", user.getUsername());
            return UserProcessingResult.failure(user.getUsername(), e.getMessage());
        } catch (SyncCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing live TV for {}", user.getUsername(), e);
            return UserProcessingResult.failure(user.getUsername(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void persist(Set<String> usernames, List<Channel> channels, List<Program> programs) {
        if (usernames.isEmpty()) {
            logger.info("No successful users, nothing to persist");
            return;
        }

        // each insert must follow its own delete; the two collections are independent
        CompletableFuture<Void> channelsReplaced = CompletableFuture
                .runAsync(() -> channelRepository.deleteByUsernames(usernames), processingExecutor)
                .thenRun(() -> channelRepository.insertAll(channels));
        CompletableFuture<Void> programsReplaced = CompletableFuture
                .runAsync(() -> programRepository.deleteByUsernames(usernames), processingExecutor)
                .thenRun(() -> programRepository.insertAll(programs));

        try {
            CompletableFuture.allOf(channelsReplaced, programsReplaced).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RepositoryException repositoryException) {
                throw repositoryException;
            }
            throw new RepositoryException("Bulk replace of live TV records failed", cause);
        }
    }

    private void evictPlaylists() {
        Cache playlists = cacheManager.getCache(CacheConfig.PLAYLIST_CACHE);
        if (playlists != null) {
            playlists.clear();
        }
    }

    private SyncResult finish(Timer.Sample timer, String status, SyncResult result) {
        timer.stop(meterRegistry.timer("livetv_sync_duration", "status", status));
        meterRegistry.counter("livetv_sync_total", "status", status).increment();
        return result;
    }

    private static <T> List<Future<T>> invokeAll(ExecutorService executor, List<Callable<T>> tasks) {
        try {
            return executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncCancelledException("Live TV sync interrupted", e);
        }
    }

    private static <T> List<T> awaitAll(List<Future<T>> futures) {
        List<T> values = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                values.add(future.get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new SyncCancelledException("Live TV sync interrupted", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof SyncCancelledException cancelled) {
                    throw cancelled;
                }
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Live TV sync task failed", e.getCause());
            } catch (java.util.concurrent.CancellationException e) {
                throw new SyncCancelledException("Live TV sync task cancelled", e);
            }
        }
        return values;
    }
}
