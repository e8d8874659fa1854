package com.playarr.livetv.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.util.Map;

/**
 * Read-only view of a row in the Users table. Only the username, the API key and the liveTV map are
 * mapped; everything else on the user record belongs to the account service.
 */
@DynamoDbBean
public class User {

    public static final String M3U_URL_KEY = "m3u_url";
    public static final String EPG_URL_KEY = "epg_url";
    public static final String API_KEY_INDEX = "ApiKeyIndex";

    private String username;
    private String apiKey;
    private Map<String, String> liveTV;

    public User() {
    }

    public User(String username, Map<String, String> liveTV) {
        this.username = username;
        this.liveTV = liveTV;
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("username")
    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = API_KEY_INDEX)
    @DynamoDbAttribute("api_key")
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    @DynamoDbAttribute("liveTV")
    public Map<String, String> getLiveTV() {
        return liveTV;
    }

    public void setLiveTV(Map<String, String> liveTV) {
        this.liveTV = liveTV;
    }

    @DynamoDbIgnore
    public LiveTvConfig getLiveTvConfig() {
        return LiveTvConfig.from(liveTV);
    }
}
