package com.playarr.livetv.cache;

import com.playarr.livetv.config.LiveTvProperties;
import com.playarr.livetv.exception.CacheException;
import com.playarr.livetv.exception.SyncCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * On-disk cache of the last fetched playlist and guide per user.
 *
 * <pre>
 * {cacheDir}/liveTV/{username}/live.m3u   raw playlist text
 * {cacheDir}/liveTV/{username}/epg.xml    uncompressed XMLTV
 * {cacheDir}/liveTV/{username}/epg.tmp    in-flight EPG write, renamed onto epg.xml when complete
 * {cacheDir}/liveTV/.shared/              decompressed guides shared by several users during one sync
 * </pre>
 */
@Component
public class LiveTvCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(LiveTvCacheStore.class);

    static final String LIVE_TV_DIR = "liveTV";
    static final String SHARED_DIR = ".shared";
    static final String M3U_FILE = "live.m3u";
    static final String EPG_FILE = "epg.xml";
    static final String EPG_TEMP_FILE = "epg.tmp";
    private static final int COPY_BUFFER_BYTES = 64 * 1024;

    private final Path root;

    @Autowired
    public LiveTvCacheStore(LiveTvProperties properties) {
        this(Paths.get(properties.getCacheDir()));
    }

    public LiveTvCacheStore(Path cacheDir) {
        this.root = cacheDir.resolve(LIVE_TV_DIR);
    }

    public Path writeM3u(String username, String content) {
        Path target = userDir(username).resolve(M3U_FILE);
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
            logger.debug("Cached playlist for {} ({} chars)", username, content.length());
            return target;
        } catch (IOException e) {
            throw new CacheException("Failed to write playlist cache for " + username, e);
        }
    }

    public Path writeEpg(String username, String xml) {
        Path dir = userDir(username);
        Path temp = dir.resolve(EPG_TEMP_FILE);
        try {
            Files.writeString(temp, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CacheException("Failed to write EPG cache for " + username, e);
        }
        return publish(temp, dir.resolve(EPG_FILE));
    }

    /**
     * Stream {@code source} into the user's epg.xml. The stream is not closed.
     */
    public Path writeEpg(String username, InputStream source) {
        Path dir = userDir(username);
        Path temp = dir.resolve(EPG_TEMP_FILE);
        copy(source, temp);
        return publish(temp, dir.resolve(EPG_FILE));
    }

    /**
     * Copy an already decompressed guide (see {@link #createSharedEpg}) into the user's epg.xml.
     */
    public Path copyEpg(String username, Path sharedFile) {
        try (InputStream in = Files.newInputStream(sharedFile)) {
            return writeEpg(username, in);
        } catch (IOException e) {
            throw new CacheException("Failed to read shared EPG " + sharedFile, e);
        }
    }

    /**
     * Write {@code source} to a fresh file under the shared directory. The caller owns the file and
     * removes it with {@link #deleteShared} once every subscriber has a copy.
     */
    public Path createSharedEpg(InputStream source) {
        Path dir = root.resolve(SHARED_DIR);
        createDirectories(dir);
        Path target = dir.resolve("epg-" + UUID.randomUUID() + ".xml");
        copy(source, target);
        return target;
    }

    public void deleteShared(Path sharedFile) {
        try {
            Files.deleteIfExists(sharedFile);
        } catch (IOException e) {
            logger.warn("Could not delete shared EPG file {}: {}", sharedFile, e.getMessage());
        }
    }

    public Optional<String> readM3u(String username) {
        Path file = userDirPath(username).resolve(M3U_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CacheException("Failed to read playlist cache for " + username, e);
        }
    }

    public Optional<Path> getEpgPath(String username) {
        Path file = userDirPath(username).resolve(EPG_FILE);
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    /**
     * The user's cache directory, created if missing.
     */
    Path userDir(String username) {
        Path dir = userDirPath(username);
        createDirectories(dir);
        return dir;
    }

    private Path userDirPath(String username) {
        if (username == null || username.isBlank()
                || username.startsWith(".")
                || username.contains("/") || username.contains("\\")
                || username.indexOf('\0') >= 0) {
            throw new CacheException("Username cannot be used as a cache directory: " + username);
        }
        return root.resolve(username);
    }

    private Path publish(Path temp, Path target) {
        try {
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CacheException("Failed to publish " + target, e);
        }
    }

    private void copy(InputStream source, Path target) {
        byte[] buffer = new byte[COPY_BUFFER_BYTES];
        try (OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = source.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new SyncCancelledException("Interrupted while writing " + target);
                }
                out.write(buffer, 0, read);
            }
        } catch (ClosedByInterruptException e) {
            deleteQuietly(target);
            throw new SyncCancelledException("Interrupted while writing " + target, e);
        } catch (IOException e) {
            deleteQuietly(target);
            throw new CacheException("Failed to write " + target, e);
        } catch (SyncCancelledException e) {
            deleteQuietly(target);
            throw e;
        }
    }

    private void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CacheException("Failed to create cache directory " + dir, e);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not remove {}: {}", file, e.getMessage());
        }
    }
}
