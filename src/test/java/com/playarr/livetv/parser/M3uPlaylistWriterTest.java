package com.playarr.livetv.parser;

import com.playarr.livetv.model.Channel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class M3uPlaylistWriterTest {

    private final M3uPlaylistWriter writer = new M3uPlaylistWriter();

    @Test
    void write_WithChannels_EmitsHeaderEntriesAndRewrittenUrls() {
        // Given
        Channel one = new Channel("c1", "Channel One", "http://s/1");
        one.setTvgId("c1");
        one.setTvgLogo("http://l/1.png");
        one.setGroupTitle("News");
        Channel two = new Channel("channel_1", "Two", "http://s/2");

        // When
        String playlist = writer.write(List.of(one, two), "http://host:8080/");

        // Then
        assertThat(playlist.split("\n")).containsExactly(
                "#EXTM3U",
                "#EXTINF:-1 tvg-id=\"c1\" tvg-logo=\"http://l/1.png\" group-title=\"News\",Channel One",
                "http://host:8080/api/livetv/stream/c1?api_key={API_KEY}",
                "#EXTINF:-1,Two",
                "http://host:8080/api/livetv/stream/channel_1?api_key={API_KEY}");
    }

    @Test
    void streamUrl_WithReservedCharacters_EncodesChannelId() {
        String url = M3uPlaylistWriter.streamUrl("http://h", "bbc one/hd");

        assertThat(url).isEqualTo("http://h/api/livetv/stream/bbc%20one%2Fhd?api_key={API_KEY}");
    }

    @Test
    void write_ThenParse_RecoversChannelAttributes() {
        // Given
        Channel channel = new Channel("c1", "Channel, One", "http://s/1");
        channel.setTvgId("c1");
        channel.setTvgName("One");
        channel.setDuration(30);

        // When
        List<Channel> reparsed = new M3uParser().parse(writer.write(List.of(channel), "http://h"));

        // Then
        assertThat(reparsed).hasSize(1);
        assertThat(reparsed.get(0).getName()).isEqualTo("Channel, One");
        assertThat(reparsed.get(0).getTvgName()).isEqualTo("One");
        assertThat(reparsed.get(0).getDuration()).isEqualTo(30);
        assertThat(reparsed.get(0).getUrl()).isEqualTo("http://h/api/livetv/stream/c1?api_key={API_KEY}");
    }

    @Test
    void write_WithNoChannels_EmitsOnlyHeader() {
        assertThat(writer.write(List.of(), "http://h")).isEqualTo("#EXTM3U");
    }
}
