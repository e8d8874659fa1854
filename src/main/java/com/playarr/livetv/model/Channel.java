package com.playarr.livetv.model;

import com.playarr.livetv.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.time.Instant;
import java.util.Objects;

/**
 * One playlist entry for one user, stored in the LiveTvChannels table.
 *
 * Key Pattern: PK = username, SK = channel_id
 */
@DynamoDbBean
public class Channel {

    public static final String UNKNOWN_NAME = "Unknown Channel";
    public static final int UNSPECIFIED_DURATION = -1;

    private String username;
    private String channelId;
    private String name;
    private String url;
    private String tvgId;
    private String tvgName;
    private String tvgLogo;
    private String groupTitle;
    private Integer duration;
    private Instant createdAt;
    private Instant lastUpdated;

    public Channel() {
    }

    public Channel(String channelId, String name, String url) {
        this.channelId = channelId;
        this.name = name;
        this.url = url;
        this.duration = UNSPECIFIED_DURATION;
    }

    /**
     * Copy of this channel owned by the given user, with both timestamps set to {@code now}.
     */
    public Channel forUser(String owner, Instant now) {
        Channel copy = new Channel(channelId, name, url);
        copy.setUsername(owner);
        copy.setTvgId(tvgId);
        copy.setTvgName(tvgName);
        copy.setTvgLogo(tvgLogo);
        copy.setGroupTitle(groupTitle);
        copy.setDuration(duration);
        copy.setCreatedAt(now);
        copy.setLastUpdated(now);
        return copy;
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
    @DynamoDbAttribute("channel_id")
    public String getChannelId() {
        return channelId;
    }

    public void setChannelId(String channelId) {
        this.channelId = channelId;
    }

    @DynamoDbAttribute("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @DynamoDbAttribute("url")
    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    @DynamoDbAttribute("tvg_id")
    public String getTvgId() {
        return tvgId;
    }

    public void setTvgId(String tvgId) {
        this.tvgId = tvgId;
    }

    @DynamoDbAttribute("tvg_name")
    public String getTvgName() {
        return tvgName;
    }

    public void setTvgName(String tvgName) {
        this.tvgName = tvgName;
    }

    @DynamoDbAttribute("tvg_logo")
    public String getTvgLogo() {
        return tvgLogo;
    }

    public void setTvgLogo(String tvgLogo) {
        this.tvgLogo = tvgLogo;
    }

    @DynamoDbAttribute("group_title")
    public String getGroupTitle() {
        return groupTitle;
    }

    public void setGroupTitle(String groupTitle) {
        this.groupTitle = groupTitle;
    }

    @DynamoDbAttribute("duration")
    public Integer getDuration() {
        return duration;
    }

    public void setDuration(Integer duration) {
        this.duration = duration;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Channel channel = (Channel) o;
        return Objects.equals(username, channel.username)
                && Objects.equals(channelId, channel.channelId)
                && Objects.equals(name, channel.name)
                && Objects.equals(url, channel.url)
                && Objects.equals(tvgId, channel.tvgId)
                && Objects.equals(tvgName, channel.tvgName)
                && Objects.equals(tvgLogo, channel.tvgLogo)
                && Objects.equals(groupTitle, channel.groupTitle)
                && Objects.equals(duration, channel.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, channelId, name, url, tvgId, tvgName, tvgLogo, groupTitle, duration);
    }

    @Override
    public String toString() {
        return "Channel{" +
                "username='" + username + '\'' +
                ", channelId='" + channelId + '\'' +
                ", name='" + name + '\'' +
                ", url='" + url + '\'' +
                '}';
    }
}
