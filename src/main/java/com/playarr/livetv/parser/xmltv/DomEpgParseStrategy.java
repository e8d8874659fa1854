package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.exception.EpgParseException;
import com.playarr.livetv.exception.SyncCancelledException;
import com.playarr.livetv.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the whole XMLTV document into a DOM, then walks the programmes in fixed-size batches.
 * Meant for documents small enough to hold in memory; deep nesting can exhaust the stack, which is
 * reported as {@link EpgParseException.ErrorType#STACK_EXHAUSTED}.
 */
@Component
public class DomEpgParseStrategy implements EpgParseStrategy {

    private static final Logger logger = LoggerFactory.getLogger(DomEpgParseStrategy.class);

    static final int BATCH_SIZE = 5_000;
    static final int PROGRESS_LOG_INTERVAL = 50_000;

    @Override
    public String name() {
        return "DOM";
    }

    @Override
    public List<Program> parse(Path xmlFile) {
        Document document = load(xmlFile);
        // getTextContent() recurses over the children of each field, so deep markup can overflow here too
        try {
            return walk(document, xmlFile);
        } catch (StackOverflowError e) {
            throw EpgParseException.stackExhausted(e);
        }
    }

    private List<Program> walk(Document document, Path xmlFile) {
        ProgrammeNormalizer normalizer = new ProgrammeNormalizer();
        NodeList channelNodes = document.getElementsByTagName("channel");
        for (int i = 0; i < channelNodes.getLength(); i++) {
            normalizer.advertiseChannel(((Element) channelNodes.item(i)).getAttribute("id"));
        }

        NodeList programmeNodes = document.getElementsByTagName("programme");
        int total = programmeNodes.getLength();
        logger.debug("DOM loaded {} channels and {} programmes from {}", normalizer.advertisedChannelCount(), total, xmlFile);

        List<Program> programs = new ArrayList<>();
        for (int batchStart = 0; batchStart < total; batchStart += BATCH_SIZE) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SyncCancelledException("EPG parse of " + xmlFile + " interrupted");
            }

            int batchEnd = Math.min(batchStart + BATCH_SIZE, total);
            for (int i = batchStart; i < batchEnd; i++) {
                normalizer.normalize(read((Element) programmeNodes.item(i))).ifPresent(programs::add);
            }

            if (batchEnd % PROGRESS_LOG_INTERVAL == 0) {
                logger.debug("Processed {}/{} programmes, {} kept", batchEnd, total, programs.size());
            }
        }

        normalizer.logSummary(name());
        return programs;
    }

    private Document load(Path xmlFile) {
        try (InputStream in = Files.newInputStream(xmlFile)) {
            DocumentBuilder builder = newDocumentBuilderFactory().newDocumentBuilder();
            return builder.parse(in, xmlFile.toUri().toString());
        } catch (StackOverflowError e) {
            throw EpgParseException.stackExhausted(e);
        } catch (SAXException e) {
            throw EpgParseException.malformed(e.getMessage(), e);
        } catch (ClosedByInterruptException e) {
            throw new SyncCancelledException("EPG read of " + xmlFile + " interrupted", e);
        } catch (IOException e) {
            throw EpgParseException.io("Failed to read EPG file " + xmlFile, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support required features", e);
        }
    }

    private RawProgramme read(Element element) {
        RawProgramme raw = new RawProgramme(
                element.getAttribute("channel"),
                element.getAttribute("start"),
                element.getAttribute("stop"));

        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element field = (Element) child;
            switch (field.getTagName()) {
                case "title" -> raw.offerTitle(field.getTextContent().trim());
                case "desc" -> raw.offerDesc(field.getTextContent().trim());
                case "category" -> raw.offerCategory(field.getTextContent().trim());
                case "episode-num" -> raw.offerEpisode(field.getTextContent().trim());
                case "icon" -> {
                    if (field.hasAttribute("src")) {
                        raw.offerIcon(field.getAttribute("src"));
                    }
                }
                default -> {
                    // credits, rating, sub-title etc. are not stored
                }
            }
        }
        return raw;
    }

    static DocumentBuilderFactory newDocumentBuilderFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        // XMLTV files routinely carry <!DOCTYPE tv SYSTEM "xmltv.dtd">; allow it but never fetch it
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory;
    }
}
