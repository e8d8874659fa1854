package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.exception.EpgParseException;
import com.playarr.livetv.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for XMLTV parsing.
 *
 * Files up to 10 MiB go through the DOM strategy; larger ones are streamed. When the DOM strategy
 * fails with stack exhaustion the same file is re-read with the streaming strategy, so callers never
 * see that failure. Every other parse failure propagates.
 */
@Component
public class EpgParser {

    private static final Logger logger = LoggerFactory.getLogger(EpgParser.class);

    public static final long DOM_THRESHOLD_BYTES = 10L * 1024 * 1024;

    private final EpgParseStrategy domStrategy;
    private final EpgParseStrategy streamingStrategy;

    @Autowired
    public EpgParser(DomEpgParseStrategy domStrategy, StreamingEpgParseStrategy streamingStrategy) {
        this((EpgParseStrategy) domStrategy, (EpgParseStrategy) streamingStrategy);
    }

    /**
     * Constructor for testing with arbitrary strategies.
     */
    EpgParser(EpgParseStrategy domStrategy, EpgParseStrategy streamingStrategy) {
        this.domStrategy = domStrategy;
        this.streamingStrategy = streamingStrategy;
    }

    /**
     * Parse an uncompressed XMLTV file into programme records without an owner.
     *
     * @throws EpgParseException when the document cannot be parsed by the selected strategy
     */
    public List<Program> parse(Path xmlFile) {
        long size = sizeOf(xmlFile);
        EpgParseStrategy strategy = selectStrategy(size);
        logger.info("Parsing EPG {} ({} bytes) with {} strategy", xmlFile.getFileName(), size, strategy.name());

        if (strategy != domStrategy) {
            return strategy.parse(xmlFile);
        }

        try {
            return domStrategy.parse(xmlFile);
        } catch (EpgParseException e) {
            if (!e.isStackExhaustion()) {
                throw e;
            }
            logger.warn("DOM parse of {} exhausted the stack, retrying with {} strategy",
                    xmlFile.getFileName(), streamingStrategy.name());
            return streamingStrategy.parse(xmlFile);
        }
    }

    EpgParseStrategy selectStrategy(long sizeBytes) {
        return sizeBytes <= DOM_THRESHOLD_BYTES ? domStrategy : streamingStrategy;
    }

    private static long sizeOf(Path xmlFile) {
        try {
            return Files.size(xmlFile);
        } catch (IOException e) {
            throw EpgParseException.io("Cannot stat EPG file " + xmlFile, e);
        }
    }
}
