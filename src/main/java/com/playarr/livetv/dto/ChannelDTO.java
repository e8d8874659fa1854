package com.playarr.livetv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.playarr.livetv.model.Channel;

/**
 * A channel as returned to clients, optionally with the programme currently airing on it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChannelDTO {

    @JsonProperty("channel_id")
    private String channelId;

    private String name;
    private String url;

    @JsonProperty("tvg_id")
    private String tvgId;

    @JsonProperty("tvg_name")
    private String tvgName;

    @JsonProperty("tvg_logo")
    private String tvgLogo;

    @JsonProperty("group_title")
    private String groupTitle;

    private Integer duration;

    @JsonProperty("current_program")
    private ProgramDTO currentProgram;

    // Default constructor for Jackson
    public ChannelDTO() {
    }

    public static ChannelDTO from(Channel channel, ProgramDTO currentProgram) {
        ChannelDTO dto = new ChannelDTO();
        dto.channelId = channel.getChannelId();
        dto.name = channel.getName();
        dto.url = channel.getUrl();
        dto.tvgId = channel.getTvgId();
        dto.tvgName = channel.getTvgName();
        dto.tvgLogo = channel.getTvgLogo();
        dto.groupTitle = channel.getGroupTitle();
        dto.duration = channel.getDuration();
        dto.currentProgram = currentProgram;
        return dto;
    }

    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getTvgId() {
        return tvgId;
    }

    public void setTvgId(String tvgId) {
        this.tvgId = tvgId;
    }

    public String getTvgName() {
        return tvgName;
    }

    public void setTvgName(String tvgName) {
        this.tvgName = tvgName;
    }

    public String getTvgLogo() {
        return tvgLogo;
    }

    public void setTvgLogo(String tvgLogo) {
        this.tvgLogo = tvgLogo;
    }

    public String getGroupTitle() {
        return groupTitle;
    }

    public void setGroupTitle(String groupTitle) {
        this.groupTitle = groupTitle;
    }

    public Integer getDuration() {
        return duration;
    }

    public void setDuration(Integer duration) {
        this.duration = duration;
    }

    public ProgramDTO getCurrentProgram() {
        return currentProgram;
    }

    public void setCurrentProgram(ProgramDTO currentProgram) {
        this.currentProgram = currentProgram;
    }
}
