package com.docverify.client;

/**
 * Raw bytes of a fetched document with the media type it will be sent as.
 */
public record DownloadedDocument(byte[] content, String mediaType) {

    public int size() {
        return content.length;
    }
}
