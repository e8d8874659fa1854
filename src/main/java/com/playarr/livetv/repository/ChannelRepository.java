package com.playarr.livetv.repository;

import com.playarr.livetv.model.Channel;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ChannelRepository {

    /**
     * Remove every channel owned by any of the given users.
     *
     * @return number of channels removed
     */
    int deleteByUsernames(Collection<String> usernames);

    /**
     * Insert channels in batches. Fails as a whole if any batch cannot be written.
     *
     * @return number of channels written
     */
    int insertAll(List<Channel> channels);

    List<Channel> findByUsername(String username);

    Optional<Channel> findOne(String username, String channelId);
}
