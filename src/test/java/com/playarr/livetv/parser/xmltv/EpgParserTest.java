package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.exception.EpgParseException;
import com.playarr.livetv.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EpgParserTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Strategy selection and fallback")
    @ExtendWith(MockitoExtension.class)
    class SelectionTests {

        @Mock
        private EpgParseStrategy dom;

        @Mock
        private EpgParseStrategy streaming;

        private EpgParser parser;

        @BeforeEach
        void setUp() {
            lenient().when(dom.name()).thenReturn("DOM");
            lenient().when(streaming.name()).thenReturn("streaming");
            parser = new EpgParser(dom, streaming);
        }

        @Test
        void selectStrategy_AtThreshold_UsesDom() {
            assertThat(parser.selectStrategy(0)).isSameAs(dom);
            assertThat(parser.selectStrategy(EpgParser.DOM_THRESHOLD_BYTES)).isSameAs(dom);
        }

        @Test
        void selectStrategy_AboveThreshold_UsesStreaming() {
            assertThat(parser.selectStrategy(EpgParser.DOM_THRESHOLD_BYTES + 1)).isSameAs(streaming);
        }

        @Test
        void parse_WhenDomExhaustsStack_RetriesWithStreaming() throws Exception {
            // Given
            Path file = XmltvFixtures.write(tempDir, "epg.xml", "<tv/>");
            Program program = new Program("c1", Instant.parse("2024-01-01T12:00:00Z"),
                    Instant.parse("2024-01-01T13:00:00Z"), "Show");
            when(dom.parse(file)).thenThrow(EpgParseException.stackExhausted(new StackOverflowError()));
            when(streaming.parse(file)).thenReturn(List.of(program));

            // When
            List<Program> result = parser.parse(file);

            // Then
            assertThat(result).containsExactly(program);
        }

        @Test
        void parse_WhenDomReportsStackInMessage_RetriesWithStreaming() throws Exception {
            // Given
            Path file = XmltvFixtures.write(tempDir, "epg.xml", "<tv/>");
            when(dom.parse(file)).thenThrow(
                    EpgParseException.malformed("Maximum call stack size exceeded", null));
            when(streaming.parse(file)).thenReturn(List.of());

            // When
            List<Program> result = parser.parse(file);

            // Then
            assertThat(result).isEmpty();
            verify(streaming).parse(file);
        }

        @Test
        void parse_WhenDomFailsOtherwise_PropagatesWithoutFallback() throws Exception {
            // Given
            Path file = XmltvFixtures.write(tempDir, "epg.xml", "<tv>");
            when(dom.parse(file)).thenThrow(EpgParseException.malformed("unexpected end of file", null));

            // When / Then
            assertThatThrownBy(() -> parser.parse(file)).isInstanceOf(EpgParseException.class);
            verify(streaming, never()).parse(file);
        }

        @Test
        void parse_WithMissingFile_ThrowsIo() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.xml")))
                    .isInstanceOf(EpgParseException.class)
                    .satisfies(e -> assertThat(((EpgParseException) e).getErrorType())
                            .isEqualTo(EpgParseException.ErrorType.IO));
        }
    }

    @Nested
    @DisplayName("Real strategies")
    class RealStrategyTests {

        private final DomEpgParseStrategy dom = new DomEpgParseStrategy();
        private final StreamingEpgParseStrategy streaming = new StreamingEpgParseStrategy();
        private final EpgParser parser = new EpgParser(dom, streaming);

        @Test
        void parse_WithFileLargerThanThreshold_StreamsWholeDocument() throws Exception {
            // Given
            Path file = XmltvFixtures.writeLarge(tempDir, "large.xml", 100, 400);
            assertThat(Files.size(file)).isGreaterThan(EpgParser.DOM_THRESHOLD_BYTES);

            // When
            List<Program> programs = parser.parse(file);

            // Then
            assertThat(parser.selectStrategy(Files.size(file))).isSameAs(streaming);
            assertThat(programs).hasSize(100 * 400);
            assertThat(programs).allSatisfy(p -> assertThat(p.getStop()).isAfter(p.getStart()));
        }

        @Test
        void parse_WithDeeplyNestedSmallFile_FallsBackToStreaming() throws Exception {
            // Given
            Path file = XmltvFixtures.writeDeeplyNested(tempDir, "deep.xml", 200_000);
            assertThat(Files.size(file)).isLessThanOrEqualTo(EpgParser.DOM_THRESHOLD_BYTES);

            // When
            List<Program> programs = parser.parse(file);

            // Then
            assertThat(programs).hasSize(1);
            assertThat(programs.get(0).getChannelId()).isEqualTo("c1");
            assertThat(programs.get(0).getTitle()).isEqualTo("Deep");
        }

        @Test
        void parse_WithSmallFile_ProducesSameRecordsAsStreaming() throws Exception {
            // Given
            Path file = XmltvFixtures.writeLarge(tempDir, "small.xml", 3, 30);

            // When
            List<Program> viaParser = parser.parse(file);

            // Then
            assertThat(viaParser).containsExactlyElementsOf(streaming.parse(file));
        }
    }
}
