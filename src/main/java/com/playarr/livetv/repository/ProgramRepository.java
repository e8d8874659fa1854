package com.playarr.livetv.repository;

import com.playarr.livetv.model.Program;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ProgramRepository {

    /**
     * Remove every programme owned by any of the given users.
     *
     * @return number of programmes removed
     */
    int deleteByUsernames(Collection<String> usernames);

    /**
     * Insert programmes in batches. Fails as a whole if any batch cannot be written.
     *
     * @return number of programmes written
     */
    int insertAll(List<Program> programs);

    /**
     * A channel's guide for one user, ordered by start ascending.
     */
    List<Program> findByUsernameAndChannel(String username, String channelId);

    /**
     * Programmes of any channel for which {@code start <= now <= stop}.
     */
    List<Program> findCurrent(String username, Instant now);
}
