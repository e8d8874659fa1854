package com.playarr.livetv.model;

import com.playarr.livetv.util.InstantAsLongAttributeConverter;
import com.playarr.livetv.util.LiveTvKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.time.Instant;
import java.util.Objects;

/**
 * One guide entry for one user, stored in the LiveTvPrograms table.
 *
 * Key Pattern: PK = username, SK = {channel_id}#{start ms}#{stop ms}
 */
@DynamoDbBean
public class Program {

    public static final String UNKNOWN_TITLE = "Unknown";

    private String username;
    private String programKey;
    private String channelId;
    private Instant start;
    private Instant stop;
    private String title;
    private String desc;
    private String category;
    private String icon;
    private String episode;
    private Instant createdAt;
    private Instant lastUpdated;

    public Program() {
    }

    public Program(String channelId, Instant start, Instant stop, String title) {
        this.channelId = channelId;
        this.start = start;
        this.stop = stop;
        this.title = title;
        this.programKey = LiveTvKeyFactory.programSortKey(channelId, start.toEpochMilli(), stop.toEpochMilli());
    }

    /**
     * Copy of this programme owned by the given user, with both timestamps set to {@code now}.
     */
    public Program forUser(String owner, Instant now) {
        Program copy = new Program(channelId, start, stop, title);
        copy.setUsername(owner);
        copy.setDesc(desc);
        copy.setCategory(category);
        copy.setIcon(icon);
        copy.setEpisode(episode);
        copy.setCreatedAt(now);
        copy.setLastUpdated(now);
        return copy;
    }

    /**
     * Whether the programme is on air at {@code instant}, both bounds inclusive.
     */
    public boolean isAiringAt(Instant instant) {
        return !start.isAfter(instant) && !stop.isBefore(instant);
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("username")
    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    @DynamoDbSortKey
    @DynamoDbAttribute("program_key")
    public String getProgramKey() {
        return programKey;
    }

    public void setProgramKey(String programKey) {
        this.programKey = programKey;
    }

    @DynamoDbAttribute("channel_id")
    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    @DynamoDbAttribute("start")
    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getStart() {
        return start;
    }

    public void setStart(Instant start) {
        this.start = start;
    }

    @DynamoDbAttribute("stop")
    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getStop() {
        return stop;
    }

    public void setStop(Instant stop) {
        this.stop = stop;
    }

    @DynamoDbAttribute("title")
    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    @DynamoDbAttribute("desc")
    public String getDesc() {
        return desc;
    }

    public void setDesc(String desc) {
        this.desc = desc;
    }

    @DynamoDbAttribute("category")
    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    @DynamoDbAttribute("icon")
    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    @DynamoDbAttribute("episode")
    public String getEpisode() {
        return episode;
    }

    public void setEpisode(String episode) {
        this.episode = episode;
    }

    @DynamoDbAttribute("created_at")
    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbAttribute("last_updated")
    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    @DynamoDbIgnore
    public long getDurationMs() {
        return stop.toEpochMilli() - start.toEpochMilli();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Program program = (Program) o;
        return Objects.equals(username, program.username)
                && Objects.equals(channelId, program.channelId)
                && Objects.equals(start, program.start)
                && Objects.equals(stop, program.stop)
                && Objects.equals(title, program.title)
                && Objects.equals(desc, program.desc)
                && Objects.equals(category, program.category)
                && Objects.equals(icon, program.icon)
                && Objects.equals(episode, program.episode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, channelId, start, stop, title, desc, category, icon, episode);
    }

    @Override
    public String toString() {
        return "Program{" +
                "channelId='" + channelId + '\'' +
                ", start=" + start +
                ", stop=" + stop +
                ", title='" + title + '\'' +
                '}';
    }
}
