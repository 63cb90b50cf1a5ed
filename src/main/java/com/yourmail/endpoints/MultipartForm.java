package com.yourmail.endpoints;

import com.yourmail.delivery.AttachmentUpload;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.ContentDisposition;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed multipart/form-data request.
 *
 * <p>Text fields are collected by name. Parts with a file name become uploads.
 */
public class MultipartForm {
    private static final Logger log = LogManager.getLogger(MultipartForm.class);

    private final Map<String, String> fields = new HashMap<>();
    private final Map<String, List<AttachmentUpload>> files = new HashMap<>();

    /**
     * Parses a multipart body.
     *
     * @param body        Request body.
     * @param contentType Request Content-Type with boundary.
     * @return MultipartForm instance.
     * @throws IOException Malformed body.
     */
    public static MultipartForm parse(byte[] body, String contentType) throws IOException {
        MultipartForm form = new MultipartForm();
        try {
            MimeMultipart multipart = new MimeMultipart(new ByteArrayDataSource(body, contentType));
            for (int i = 0; i < multipart.getCount(); i++) {
                form.add(multipart.getBodyPart(i));
            }
        } catch (MessagingException e) {
            throw new IOException("Malformed multipart body: " + e.getMessage(), e);
        }
        log.debug("Parsed multipart form: fields={}, files={}", form.fields.keySet(), form.files.keySet());
        return form;
    }

    private void add(BodyPart part) throws MessagingException, IOException {
        String[] disposition = part.getHeader("Content-Disposition");
        if (disposition == null || disposition.length == 0) {
            return;
        }
        ContentDisposition cd = new ContentDisposition(disposition[0]);
        String name = cd.getParameter("name");
        if (name == null) {
            return;
        }

        byte[] data;
        try (InputStream is = part.getInputStream()) {
            data = is.readAllBytes();
        }

        String filename = cd.getParameter("filename");
        if (filename != null) {
            String type = part.getContentType() != null ? new ContentType(part.getContentType()).getBaseType() : null;
            files.computeIfAbsent(name, k -> new ArrayList<>()).add(new AttachmentUpload(filename, type, data));
        } else {
            fields.put(name, new String(data, StandardCharsets.UTF_8));
        }
    }

    /**
     * Gets a text field.
     *
     * @param name Field name.
     * @return Value or null.
     */
    public String getField(String name) {
        return fields.get(name);
    }

    /**
     * Gets uploaded files for a field.
     *
     * @param name Field name.
     * @return List of AttachmentUpload, empty if none.
     */
    public List<AttachmentUpload> getFiles(String name) {
        return files.getOrDefault(name, new ArrayList<>());
    }
}
