package com.playarr.livetv.repository;

import com.playarr.livetv.model.User;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the Users table. User records are owned elsewhere; live TV only reads them.
 */
public interface UserRepository {

    /**
     * Every user with the username and liveTV attributes loaded, including users without
     * live TV so callers can tell "not configured" from "configured but corrupt".
     */
    List<User> findAllLiveTvConfigs();

    /**
     * Username owning the given API key, looked up through the ApiKeyIndex.
     */
    Optional<String> findUsernameByApiKey(String apiKey);
}
