package com.playarr.livetv.parser.xmltv;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * XMLTV documents shared by the parser and sync tests.
 */
public final class XmltvFixtures {

    static final String BASIC = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE tv SYSTEM "xmltv.dtd">
            <tv generator-info-name="test">
              <channel id="c1"><display-name>Channel One</display-name></channel>
              <channel id=" c2 "><display-name>Channel Two</display-name></channel>
              <programme channel="c1" start="20240101120000 +0000" stop="20240101130000 +0000">
                <title lang="en">  Show  </title>
                <title lang="de">Sendung</title>
                <desc>An episode</desc>
                <category>Drama</category>
                <episode-num system="onscreen">S01E02</episode-num>
                <icon src="http://i/1.png"/>
                <rating system="MPAA"><value>PG</value><icon src="http://i/rating.png"/></rating>
              </programme>
              <programme channel="c2" start="20240101130000 +0100" stop="20240101140000 +0100">
                <title></title>
              </programme>
              <programme channel="unknown" start="20240101120000 +0000" stop="20240101130000 +0000">
                <title>Orphan</title>
              </programme>
              <programme channel="c1" start="not-a-date" stop="20240101130000 +0000">
                <title>Bad start</title>
              </programme>
              <programme channel="c1" start="20240101130000 +0000" stop="20240101130000 +0000">
                <title>Zero length</title>
              </programme>
              <programme channel="c1" start="20240101120000 +0000" stop="20240101130000 +0000">
                <title>Duplicate</title>
              </programme>
            </tv>
            """;

    private XmltvFixtures() {
    }

    static Path write(Path dir, String name, String xml) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, xml, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * A document with {@code channels} channels and {@code programmesPerChannel} consecutive one-hour
     * programmes on each, padded with descriptions so it grows past the DOM threshold quickly.
     */
    public static Path writeLarge(Path dir, String name, int channels, int programmesPerChannel) throws IOException {
        Path file = dir.resolve(name);
        String padding = "x".repeat(200);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<tv>\n");
            for (int c = 0; c < channels; c++) {
                out.write("<channel id=\"ch" + c + "\"><display-name>Channel " + c + "</display-name></channel>\n");
            }
            for (int c = 0; c < channels; c++) {
                for (int p = 0; p < programmesPerChannel; p++) {
                    int day = 1 + p / 24;
                    int hour = p % 24;
                    String start = String.format("202401%02d%02d0000 +0000", day, hour);
                    String stop = hour == 23
                            ? String.format("202401%02d000000 +0000", day + 1)
                            : String.format("202401%02d%02d0000 +0000", day, hour + 1);
                    out.write("<programme channel=\"ch" + c + "\" start=\"" + start + "\" stop=\"" + stop + "\">"
                            + "<title>Show " + p + "</title><desc>" + padding + "</desc></programme>\n");
                }
            }
            out.write("</tv>\n");
        }
        return file;
    }

    /**
     * One programme whose title wraps its text in {@code depth} nested {@code <b>} elements. Small on
     * disk, but deep enough that recursive DOM text extraction overflows the stack.
     */
    static Path writeDeeplyNested(Path dir, String name, int depth) throws IOException {
        Path file = dir.resolve(name);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<tv>\n");
            out.write("<channel id=\"c1\"><display-name>Channel One</display-name></channel>\n");
            out.write("<programme channel=\"c1\" start=\"20240101120000 +0000\" stop=\"20240101130000 +0000\"><title>");
            for (int i = 0; i < depth; i++) {
                out.write("<b>");
            }
            out.write("Deep");
            for (int i = 0; i < depth; i++) {
                out.write("</b>");
            }
            out.write("</title></programme>\n</tv>\n");
        }
        return file;
    }
}
