package com.yourmail.delivery;

/**
 * Uploaded attachment waiting to be stored.
 */
public class AttachmentUpload {

    private final String filename;
    private final String contentType;
    private final byte[] data;

    public AttachmentUpload(String filename, String contentType, byte[] data) {
        this.filename = filename;
        this.contentType = contentType;
        this.data = data;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getData() {
        return data;
    }
}
