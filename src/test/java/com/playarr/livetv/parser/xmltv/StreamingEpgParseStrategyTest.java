package com.playarr.livetv.parser.xmltv;

import com.playarr.livetv.exception.EpgParseException;
import com.playarr.livetv.exception.SyncCancelledException;
import com.playarr.livetv.model.Program;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamingEpgParseStrategyTest {

    @TempDir
    Path tempDir;

    private final StreamingEpgParseStrategy strategy = new StreamingEpgParseStrategy();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void parse_WithBasicDocument_KeepsOnlyValidProgrammes() throws Exception {
        // Given
        Path file = XmltvFixtures.write(tempDir, "epg.xml", XmltvFixtures.BASIC);

        // When
        List<Program> programs = strategy.parse(file);

        // Then
        assertThat(programs).extracting(Program::getChannelId).containsExactly("c1", "c2");
        Program first = programs.get(0);
        assertThat(first.getTitle()).isEqualTo("Show");
        assertThat(first.getDesc()).isEqualTo("An episode");
        assertThat(first.getCategory()).isEqualTo("Drama");
        assertThat(first.getEpisode()).isEqualTo("S01E02");
        assertThat(first.getIcon()).isEqualTo("http://i/1.png");
        assertThat(programs.get(1).getTitle()).isEqualTo("Unknown");
        assertThat(programs.get(1).getStart()).isEqualTo(Instant.parse("2024-01-01T12:00:00Z"));
    }

    @Test
    void parse_WithSameDocument_MatchesDomStrategy() throws Exception {
        // Given
        Path file = XmltvFixtures.write(tempDir, "epg.xml", XmltvFixtures.BASIC);

        // When
        List<Program> streamed = strategy.parse(file);
        List<Program> dom = new DomEpgParseStrategy().parse(file);

        // Then
        assertThat(streamed).containsExactlyElementsOf(dom);
    }

    @Test
    void parse_WithCdataAndEntities_DecodesText() throws Exception {
        // Given
        String xml = "<tv><channel id=\"c1\"/>"
                + "<programme channel=\"c1\" start=\"20240101120000 +0000\" stop=\"20240101130000 +0000\">"
                + "<title>Tom &amp; Jerry</title><desc><![CDATA[<b>bold</b>]]></desc></programme></tv>";
        Path file = XmltvFixtures.write(tempDir, "epg.xml", xml);

        // When
        List<Program> programs = strategy.parse(file);

        // Then
        assertThat(programs).hasSize(1);
        assertThat(programs.get(0).getTitle()).isEqualTo("Tom & Jerry");
        assertThat(programs.get(0).getDesc()).isEqualTo("<b>bold</b>");
    }

    @Test
    void parse_WithChannelDeclaredAfterItsProgrammes_DropsThoseProgrammes() throws Exception {
        String xml = "<tv>"
                + "<programme channel=\"c1\" start=\"20240101120000 +0000\" stop=\"20240101130000 +0000\"><title>Early</title></programme>"
                + "<channel id=\"c1\"/>"
                + "</tv>";
        Path file = XmltvFixtures.write(tempDir, "epg.xml", xml);

        assertThat(strategy.parse(file)).isEmpty();
    }

    @Test
    void parse_WithTruncatedDocument_ThrowsMalformed() throws Exception {
        // Given
        Path file = XmltvFixtures.write(tempDir, "epg.xml",
                "<tv><channel id=\"c1\"/><programme channel=\"c1\" start=\"20240101120000 +0000\"");

        // When / Then
        assertThatThrownBy(() -> strategy.parse(file))
                .isInstanceOf(EpgParseException.class)
                .satisfies(e -> assertThat(((EpgParseException) e).getErrorType())
                        .isEqualTo(EpgParseException.ErrorType.MALFORMED));
    }

    @Test
    void parse_WhenInterrupted_ThrowsCancelled() throws Exception {
        // Given
        Path file = XmltvFixtures.write(tempDir, "epg.xml", XmltvFixtures.BASIC);
        Thread.currentThread().interrupt();

        // When / Then
        assertThatThrownBy(() -> strategy.parse(file)).isInstanceOf(SyncCancelledException.class);
    }

    @Test
    void parse_WithManyProgrammes_ReturnsAllOfThem() throws Exception {
        Path file = XmltvFixtures.writeLarge(tempDir, "epg.xml", 5, 48);

        List<Program> programs = strategy.parse(file);

        assertThat(programs).hasSize(5 * 48);
        assertThat(programs.get(0).getProgramKey()).startsWith("ch0#");
    }
}
