package com.playarr.livetv.parser.xmltv;

/**
 * Untyped fields of one {@code <programme>} element as read from the document.
 * Repeated children keep their first value, whichever strategy reads them.
 */
class RawProgramme {

    private final String channel;
    private final String start;
    private final String stop;
    private String title;
    private String desc;
    private String category;
    private String icon;
    private String episode;

    RawProgramme(String channel, String start, String stop) {
        this.channel = channel;
        this.start = start;
        this.stop = stop;
    }

    void offerTitle(String value) {
        if (title == null) {
            title = value;
        }
    }

    void offerDesc(String value) {
        if (desc == null) {
            desc = value;
        }
    }

    void offerCategory(String value) {
        if (category == null) {
            category = value;
        }
    }

    void offerIcon(String value) {
        if (icon == null) {
            icon = value;
        }
    }

    void offerEpisode(String value) {
        if (episode == null) {
            episode = value;
        }
    }

    String getChannel() {
        return channel;
    }

    String getStart() {
        return start;
    }

    String getStop() {
        return stop;
    }

    String getTitle() {
        return title;
    }

    String getDesc() {
        return desc;
    }

    String getCategory() {
        return category;
    }

    String getIcon() {
        return icon;
    }

    String getEpisode() {
        return episode;
    }
}
