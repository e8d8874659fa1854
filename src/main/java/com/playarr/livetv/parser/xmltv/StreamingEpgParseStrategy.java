package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.exception.EpgParseException;
import com.playarr.livetv.exception.SyncCancelledException;
import com.playarr.livetv.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * SAX-driven XMLTV reader. Memory use is bounded by the records it keeps, not by the document size.
 */
@Component
public class StreamingEpgParseStrategy implements EpgParseStrategy {

    private static final Logger logger = LoggerFactory.getLogger(StreamingEpgParseStrategy.class);

    static final int PROGRESS_LOG_INTERVAL = 50_000;
    private static final int INTERRUPT_CHECK_INTERVAL = 1_000;
    private static final int READ_BUFFER_BYTES = 256 * 1024;

    @Override
    public String name() {
        return "streaming";
    }

    @Override
    public List<Program> parse(Path xmlFile) {
        XmltvHandler handler = new XmltvHandler();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(xmlFile), READ_BUFFER_BYTES)) {
            SAXParser parser = newSaxParserFactory().newSAXParser();
            parser.parse(in, handler, xmlFile.toUri().toString());
        } catch (SAXException e) {
            if (e.getException() instanceof SyncCancelledException cancelled) {
                throw cancelled;
            }
            throw EpgParseException.malformed(e.getMessage(), e);
        } catch (ClosedByInterruptException e) {
            throw new SyncCancelledException("EPG read of " + xmlFile + " interrupted", e);
        } catch (IOException e) {
            throw EpgParseException.io("Failed to read EPG file " + xmlFile, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support required features", e);
        }

        handler.normalizer.logSummary(name());
        return handler.programs;
    }

    static SAXParserFactory newSaxParserFactory() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory;
    }

    private enum State {
        OUTSIDE,
        IN_PROGRAMME,
        IN_TITLE,
        IN_DESC,
        IN_CATEGORY,
        IN_EPISODE_NUM
    }

    private static final class XmltvHandler extends DefaultHandler {

        private final ProgrammeNormalizer normalizer = new ProgrammeNormalizer();
        private final List<Program> programs = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private State state = State.OUTSIDE;
        private RawProgramme current;
        // open elements below the current programme or field that we do not interpret
        private int nestedDepth;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) throws SAXException {
            if (state == State.OUTSIDE) {
                if ("channel".equals(qName)) {
                    normalizer.advertiseChannel(attributes.getValue("id"));
                } else if ("programme".equals(qName)) {
                    checkInterrupted();
                    current = new RawProgramme(
                            attributes.getValue("channel"),
                            attributes.getValue("start"),
                            attributes.getValue("stop"));
                    transition(State.IN_PROGRAMME);
                }
                return;
            }

            if (state != State.IN_PROGRAMME || nestedDepth > 0) {
                nestedDepth++;
                return;
            }

            switch (qName) {
                case "title" -> transition(State.IN_TITLE);
                case "desc" -> transition(State.IN_DESC);
                case "category" -> transition(State.IN_CATEGORY);
                case "episode-num" -> transition(State.IN_EPISODE_NUM);
                default -> {
                    if ("icon".equals(qName) && attributes.getValue("src") != null) {
                        current.offerIcon(attributes.getValue("src"));
                    }
                    nestedDepth++;
                }
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (state != State.OUTSIDE && state != State.IN_PROGRAMME) {
                text.append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            if (nestedDepth > 0) {
                nestedDepth--;
                return;
            }

            switch (state) {
                case IN_TITLE -> current.offerTitle(text.toString().trim());
                case IN_DESC -> current.offerDesc(text.toString().trim());
                case IN_CATEGORY -> current.offerCategory(text.toString().trim());
                case IN_EPISODE_NUM -> current.offerEpisode(text.toString().trim());
                case IN_PROGRAMME -> {
                    if ("programme".equals(qName)) {
                        normalizer.normalize(current).ifPresent(programs::add);
                        current = null;
                        transition(State.OUTSIDE);
                        if (normalizer.getSeen() % PROGRESS_LOG_INTERVAL == 0) {
                            logger.debug("Streamed {} programmes, {} kept", normalizer.getSeen(), programs.size());
                        }
                    }
                    return;
                }
                case OUTSIDE -> {
                    return;
                }
            }
            transition(State.IN_PROGRAMME);
        }

        private void transition(State next) {
            state = next;
            text.setLength(0);
        }

        private void checkInterrupted() throws SAXException {
            if (normalizer.getSeen() % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                throw new SAXException(new SyncCancelledException("Streaming EPG parse interrupted"));
            }
        }
    }
}
