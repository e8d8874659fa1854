package com.playarr.livetv.client;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 * Body of one successful upstream GET.
 *
 * Plain responses are decoded into text. Gzipped responses keep the compressed body and decompress
 * on demand; that stream can be consumed exactly once.
 */
public final class FetchedPayload {

    private final String url;
    private final String text;
    private final InputStream compressedBody;
    private boolean consumed;

    private FetchedPayload(String url, String text, InputStream compressedBody) {
        this.url = url;
        this.text = text;
        this.compressedBody = compressedBody;
    }

    public static FetchedPayload text(String url, String text) {
        return new FetchedPayload(url, text, null);
    }

    public static FetchedPayload gzipped(String url, InputStream compressedBody) {
        return new FetchedPayload(url, null, compressedBody);
    }

    public String getUrl() {
        return url;
    }

    public boolean isGzipped() {
        return compressedBody != null;
    }

    /**
     * The decoded body. Only available for plain (non-gzipped) responses.
     */
    public String getText() {
        if (isGzipped()) {
            throw new IllegalStateException("Gzipped payload from " + url + " has no text; use openStream()");
        }
        return text;
    }

    /**
     * Decompressed bytes for a gzipped payload, or the UTF-8 bytes of the text otherwise.
     * A gzipped payload may be opened only once.
     */
    public synchronized InputStream openStream() throws IOException {
        if (!isGzipped()) {
            return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        }
        if (consumed) {
            throw new IllegalStateException("Gzipped payload from " + url + " was already consumed");
        }
        try {
            GZIPInputStream decompressed = new GZIPInputStream(compressedBody, 64 * 1024);
            consumed = true;
            return decompressed;
        } catch (IOException e) {
            discard();
            throw e;
        }
    }

    /**
     * Release the compressed body if it was never consumed.
     */
    public synchronized void discard() {
        if (compressedBody != null && !consumed) {
            consumed = true;
            try {
                compressedBody.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to release compressed body from " + url, e);
            }
        }
    }
}
