package com.playarr.livetv.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One unique upstream URL and the users subscribed to it during a sync.
 *
 * After the fetch phase exactly one of {@link #getContent()}, {@link #getSharedFile()} or
 * {@link #getFailure()} is set. Subscribers are added only while users are being collected; once
 * fetching starts the entry is written only by the thread that fetches it.
 */
public class CoalescedUpstream {

    private final String url;
    private final List<String> subscribers = new ArrayList<>();
    private String content;
    private Path sharedFile;
    private RuntimeException failure;

    public CoalescedUpstream(String url) {
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public void subscribe(String username) {
        subscribers.add(username);
    }

    public List<String> getSubscribers() {
        return Collections.unmodifiableList(subscribers);
    }

    public String getContent() {
        return content;
    }

    public Path getSharedFile() {
        return sharedFile;
    }

    public RuntimeException getFailure() {
        return failure;
    }

    public boolean isFetched() {
        return content != null || sharedFile != null;
    }

    public void completeWithContent(String content) {
        this.content = content;
    }

    public void completeWithSharedFile(Path sharedFile) {
        this.sharedFile = sharedFile;
    }

    public void fail(RuntimeException failure) {
        this.failure = failure;
    }
}
