package com.yourmail.endpoints;

import com.yourmail.delivery.AttachmentUpload;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultipartFormTest {

    private static final String CONTENT_TYPE = "multipart/form-data; boundary=XyZ";

    @Test
    void fieldsAndFiles() throws IOException {
        String body = "--XyZ\r\n"
                + "Content-Disposition: form-data; name=\"subject\"\r\n\r\n"
                + "Quarterly report\r\n"
                + "--XyZ\r\n"
                + "Content-Disposition: form-data; name=\"attachments\"; filename=\"a.csv\"\r\n"
                + "Content-Type: text/csv\r\n\r\n"
                + "x,y\n1,2\r\n"
                + "--XyZ\r\n"
                + "Content-Disposition: form-data; name=\"attachments\"; filename=\"b.bin\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n"
                + "BIN\r\n"
                + "--XyZ--\r\n";

        MultipartForm form = MultipartForm.parse(body.getBytes(StandardCharsets.UTF_8), CONTENT_TYPE);

        assertEquals("Quarterly report", form.getField("subject"));
        assertNull(form.getField("body"));

        List<AttachmentUpload> files = form.getFiles("attachments");
        assertEquals(2, files.size());
        assertEquals("a.csv", files.get(0).getFilename());
        assertEquals("text/csv", files.get(0).getContentType());
        assertEquals("x,y\n1,2", new String(files.get(0).getData(), StandardCharsets.UTF_8));
        assertEquals("b.bin", files.get(1).getFilename());
        assertTrue(form.getFiles("other").isEmpty());
    }
}
