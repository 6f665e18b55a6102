package com.scholary.ade.parse;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Builds a multipart/form-data body.
 *
 * <p>Java's HttpClient has no multipart support, so parts are written by hand:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="document"; filename="report.pdf"
 * Content-Type: application/octet-stream
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="model"
 *
 * dpt-2-latest
 * --boundary--
 * </pre>
 *
 * <p>Everything is buffered in memory; the API takes single documents, not streams.
 */
public class MultipartBody {

  private static final String CRLF = "\r\n";

  private final String boundary;
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private boolean closed;

  public MultipartBody() {
    this(UUID.randomUUID().toString());
  }

  public MultipartBody(String boundary) {
    this.boundary = boundary;
  }

  public String boundary() {
    return boundary;
  }

  /** Value for the request's Content-Type header. */
  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  public MultipartBody addField(String name, String value) {
    checkOpen();
    write("--" + boundary + CRLF);
    write("Content-Disposition: form-data; name=\"" + escapeQuotes(name) + "\"" + CRLF + CRLF);
    write(value);
    write(CRLF);
    return this;
  }

  public MultipartBody addFile(String name, String filename, String contentType, byte[] content) {
    checkOpen();
    write("--" + boundary + CRLF);
    write(
        "Content-Disposition: form-data; name=\""
            + escapeQuotes(name)
            + "\"; filename=\""
            + escapeQuotes(filename)
            + "\""
            + CRLF);
    write("Content-Type: " + contentType + CRLF + CRLF);
    out.writeBytes(content);
    write(CRLF);
    return this;
  }

  /** Write the closing boundary and return the encoded body. */
  public byte[] build() {
    if (!closed) {
      write("--" + boundary + "--" + CRLF);
      closed = true;
    }
    return out.toByteArray();
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("multipart body already built");
    }
  }

  private void write(String text) {
    out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }

  static String escapeQuotes(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
