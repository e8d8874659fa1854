package com.playarr.livetv.parser;

import com.playarr.livetv.model.Channel;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;

/**
 * Re-emits a user's channels as an M3U playlist whose stream URLs point back at this service.
 * The {@code {API_KEY}} placeholder is left for the caller to fill in.
 */
@Component
public class M3uPlaylistWriter {

    public static final String API_KEY_PLACEHOLDER = "{API_KEY}";

    public String write(List<Channel> channels, String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        StringJoiner playlist = new StringJoiner("\n");
        playlist.add(M3uParser.HEADER);

        for (Channel channel : channels) {
            StringBuilder extinf = new StringBuilder(M3uParser.EXTINF)
                    .append(channel.getDuration() != null ? channel.getDuration() : Channel.UNSPECIFIED_DURATION);
            appendAttribute(extinf, "tvg-id", channel.getTvgId());
            appendAttribute(extinf, "tvg-name", channel.getTvgName());
            appendAttribute(extinf, "tvg-logo", channel.getTvgLogo());
            appendAttribute(extinf, "group-title", channel.getGroupTitle());
            extinf.append(',').append(channel.getName());

            playlist.add(extinf);
            playlist.add(streamUrl(base, channel.getChannelId()));
        }
        return playlist.toString();
    }

    static String streamUrl(String base, String channelId) {
        return base + "/api/livetv/stream/"
                + UriUtils.encodePathSegment(channelId, StandardCharsets.UTF_8)
                + "?api_key=" + API_KEY_PLACEHOLDER;
    }

    private static void appendAttribute(StringBuilder line, String key, String value) {
        if (value != null && !value.isEmpty()) {
            line.append(' ').append(key).append("=\"").append(value.replace("\"", "'")).append('"');
        }
    }
}
