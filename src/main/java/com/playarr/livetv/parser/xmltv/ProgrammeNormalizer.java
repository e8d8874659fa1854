package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.model.Program;
import com.playarr.livetv.parser.XmltvDateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validation shared by both EPG strategies. One instance covers one document: it owns the set of
 * advertised channel ids, the dedup keys already emitted and the drop counters for the summary log.
 */
class ProgrammeNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ProgrammeNormalizer.class);
    private static final int DEBUG_SAMPLE_LIMIT = 5;

    private final Set<String> advertisedChannels = new HashSet<>();
    private final Set<String> emittedKeys = new HashSet<>();

    private int seen;
    private int accepted;
    private int unknownChannel;
    private int badDate;
    private int badRange;
    private int duplicate;

    void advertiseChannel(String channelId) {
        String id = trimToNull(channelId);
        if (id != null) {
            advertisedChannels.add(id);
        }
    }

    int advertisedChannelCount() {
        return advertisedChannels.size();
    }

    /**
     * @return the programme record, or empty when the programme is dropped
     */
    Optional<Program> normalize(RawProgramme raw) {
        seen++;

        String channelId = trimToNull(raw.getChannel());
        if (channelId == null || !advertisedChannels.contains(channelId)) {
            unknownChannel++;
            return Optional.empty();
        }

        Optional<Instant> start = XmltvDateParser.parse(raw.getStart());
        Optional<Instant> stop = XmltvDateParser.parse(raw.getStop());
        if (start.isEmpty() || stop.isEmpty()) {
            if (++badDate <= DEBUG_SAMPLE_LIMIT) {
                logger.debug("Unparseable dates for channel {}: start='{}', stop='{}'",
                        channelId, raw.getStart(), raw.getStop());
            }
            return Optional.empty();
        }

        if (!stop.get().isAfter(start.get())) {
            if (++badRange <= DEBUG_SAMPLE_LIMIT) {
                logger.debug("Programme on {} does not end after it starts: start='{}', stop='{}'",
                        channelId, raw.getStart(), raw.getStop());
            }
            return Optional.empty();
        }

        String key = channelId + '|' + start.get().toEpochMilli() + '|' + stop.get().toEpochMilli();
        if (!emittedKeys.add(key)) {
            duplicate++;
            return Optional.empty();
        }

        String title = trimToNull(raw.getTitle());
        Program program = new Program(channelId, start.get(), stop.get(), title != null ? title : Program.UNKNOWN_TITLE);
        program.setDesc(trimToNull(raw.getDesc()));
        program.setCategory(trimToNull(raw.getCategory()));
        program.setIcon(trimToNull(raw.getIcon()));
        program.setEpisode(trimToNull(raw.getEpisode()));

        accepted++;
        return Optional.of(program);
    }

    int getSeen() {
        return seen;
    }

    int getAccepted() {
        return accepted;
    }

    void logSummary(String strategy) {
        double matchRate = seen == 0 ? 0.0 : (100.0 * (seen - unknownChannel)) / seen;
        logger.info("{} EPG parse: {} programmes read, {} kept, {} channels advertised, match rate {}%; "
                        + "dropped {} unknown channel, {} bad date, {} non-positive duration, {} duplicate",
                strategy, seen, accepted, advertisedChannels.size(), String.format("%.1f", matchRate),
                unknownChannel, badDate, badRange, duplicate);

        if (seen > 0 && seen == unknownChannel) {
            logger.warn("No programme matched an advertised channel. Sample channel ids: {}",
                    advertisedChannels.stream().limit(DEBUG_SAMPLE_LIMIT).collect(Collectors.joining(", ")));
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
