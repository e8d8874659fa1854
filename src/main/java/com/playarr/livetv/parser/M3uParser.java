package com.playarr.livetv.parser;

import com.playarr.livetv.exception.PlaylistParseException;
import com.playarr.livetv.model.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses extended M3U playlists into channels.
 *
 * Recognised entries are {@code #EXTINF:<duration> key="value" ...,<display name>} followed by the
 * stream URL on the next non-comment line. A malformed entry is skipped; a buffer without the
 * {@code #EXTM3U} header yields no channels.
 */
@Component
public class M3uParser {

    private static final Logger logger = LoggerFactory.getLogger(M3uParser.class);

    static final String HEADER = "#EXTM3U";
    static final String EXTINF = "#EXTINF:";
    private static final char BOM = '\uFEFF';
    private static final Pattern ATTRIBUTE = Pattern.compile("([A-Za-z0-9_-]+)=(?:\"([^\"]*)\"|'([^']*)'|(\\S+))");

    /**
     * @param content raw playlist text
     * @return channels in playlist order, without an owner
     */
    public List<Channel> parse(String content) {
        List<Channel> channels = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return channels;
        }

        String[] lines = stripBom(content).split("\\r?\\n|\\r");
        int index = firstNonBlank(lines);
        if (index < 0 || !lines[index].trim().startsWith(HEADER)) {
            logger.warn("Playlist has no {} header, ignoring it", HEADER);
            return channels;
        }

        ExtInf pending = null;
        int skipped = 0;

        for (int i = index + 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith(EXTINF)) {
                if (pending != null) {
                    logger.debug("Entry '{}' has no stream URL, skipping", pending.name);
                    skipped++;
                }
                try {
                    pending = parseExtInf(line);
                } catch (PlaylistParseException e) {
                    logger.debug("Skipping malformed entry at line {}: {}", i + 1, e.getMessage());
                    pending = null;
                    skipped++;
                }
                continue;
            }

            if (line.startsWith("#")) {
                // #EXTGRP, #EXTVLCOPT and friends carry nothing we store
                continue;
            }

            if (pending == null) {
                logger.debug("Stream URL at line {} has no #EXTINF, skipping", i + 1);
                continue;
            }

            channels.add(toChannel(pending, line, channels.size()));
            pending = null;
        }

        if (pending != null) {
            skipped++;
        }
        if (skipped > 0) {
            logger.info("Parsed {} channels, skipped {} malformed entries", channels.size(), skipped);
        }
        return channels;
    }

    private ExtInf parseExtInf(String line) {
        String body = line.substring(EXTINF.length());
        int comma = indexOfUnquotedComma(body);
        if (comma < 0) {
            throw new PlaylistParseException("#EXTINF without display name: " + line);
        }

        String header = body.substring(0, comma).trim();
        String name = body.substring(comma + 1).trim();

        int firstSpace = firstWhitespace(header);
        String durationToken = firstSpace < 0 ? header : header.substring(0, firstSpace);
        String attributeText = firstSpace < 0 ? "" : header.substring(firstSpace);

        Map<String, String> attributes = new HashMap<>();
        Matcher matcher = ATTRIBUTE.matcher(attributeText);
        while (matcher.find()) {
            String value = matcher.group(2) != null ? matcher.group(2)
                    : matcher.group(3) != null ? matcher.group(3)
                    : matcher.group(4);
            attributes.putIfAbsent(matcher.group(1).toLowerCase(), value.trim());
        }

        return new ExtInf(parseDuration(durationToken), attributes, name);
    }

    private Channel toChannel(ExtInf entry, String url, int ordinal) {
        String tvgId = blankToNull(entry.attributes.get("tvg-id"));
        String channelId = tvgId != null ? tvgId : "channel_" + ordinal;
        String name = entry.name.isEmpty() ? Channel.UNKNOWN_NAME : entry.name;

        Channel channel = new Channel(channelId, name, url);
        channel.setTvgId(tvgId);
        channel.setTvgName(blankToNull(entry.attributes.get("tvg-name")));
        channel.setTvgLogo(blankToNull(entry.attributes.get("tvg-logo")));
        channel.setGroupTitle(blankToNull(entry.attributes.get("group-title")));
        channel.setDuration(entry.duration);
        return channel;
    }

    static int parseDuration(String token) {
        try {
            return (int) Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return Channel.UNSPECIFIED_DURATION;
        }
    }

    private static int indexOfUnquotedComma(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                // only quotes that open an attribute value count
                if (i > 0 && text.charAt(i - 1) == '=') {
                    quote = c;
                }
            } else if (c == ',') {
                return i;
            }
        }
        return -1;
    }

    private static int firstWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int firstNonBlank(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                return i;
            }
        }
        return -1;
    }

    private static String stripBom(String content) {
        return content.charAt(0) == BOM ? content.substring(1) : content;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record ExtInf(int duration, Map<String, String> attributes, String name) {
    }
}
