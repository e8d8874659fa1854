package com.playarr.livetv.model;

import java.util.Map;

/**
 * A user's live TV settings as found on the user record.
 *
 * @param present      whether the user record carries a liveTV object at all
 * @param m3uUrlKeyPresent whether that object has an m3u_url key, whatever its value
 * @param m3uUrl       trimmed playlist URL, empty when unset
 * @param epgUrl       trimmed guide URL, empty when unset
 */
public record LiveTvConfig(boolean present, boolean m3uUrlKeyPresent, String m3uUrl, String epgUrl) {

    public static final LiveTvConfig ABSENT = new LiveTvConfig(false, false, "", "");

    public static LiveTvConfig from(Map<String, String> liveTV) {
        if (liveTV == null) {
            return ABSENT;
        }
        return new LiveTvConfig(
                true,
                liveTV.containsKey(User.M3U_URL_KEY),
                trimToEmpty(liveTV.get(User.M3U_URL_KEY)),
                trimToEmpty(liveTV.get(User.EPG_URL_KEY)));
    }

    public boolean isCorrupt() {
        return present && !m3uUrlKeyPresent;
    }

    public boolean isEligible() {
        return !m3uUrl.isEmpty();
    }

    public boolean hasEpg() {
        return !epgUrl.isEmpty();
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
