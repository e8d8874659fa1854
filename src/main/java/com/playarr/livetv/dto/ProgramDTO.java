package com.playarr.livetv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.playarr.livetv.model.Program;

/**
 * A guide entry as returned to clients. Times are epoch milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgramDTO {

    @JsonProperty("channel_id")
    private String channelId;

    private long start;
    private long stop;
    private String title;
    private String desc;
    private String category;
    private String icon;
    private String episode;

    // Default constructor for Jackson
    public ProgramDTO() {
    }

    public static ProgramDTO from(Program program) {
        ProgramDTO dto = new ProgramDTO();
        dto.channelId = program.getChannelId();
        dto.start = program.getStart().toEpochMilli();
        dto.stop = program.getStop().toEpochMilli();
        dto.title = program.getTitle();
        dto.desc = program.getDesc();
        dto.category = program.getCategory();
        dto.icon = program.getIcon();
        dto.episode = program.getEpisode();
        return dto;
    }

    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    public long getStart() {
        return start;
    }

    public void setStart(long start) {
        this.start = start;
    }

    public long getStop() {
        return stop;
    }

    public void setStop(long stop) {
        this.stop = stop;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDesc() {
        return desc;
    }

    public void setDesc(String desc) {
        this.desc = desc;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public String getEpisode() {
        return episode;
    }

    public void setEpisode(String episode) {
        this.episode = episode;
    }
}
