package io.outlog.http.spring;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

/** Response whose body has been read into memory so that it can be read again. */
final class BufferedClientHttpResponse implements ClientHttpResponse {

  private final ClientHttpResponse response;
  private final byte[] body;

  private BufferedClientHttpResponse(ClientHttpResponse response, byte[] body) {
    this.response = response;
    this.body = body;
  }

  static BufferedClientHttpResponse buffer(ClientHttpResponse response) throws IOException {
    if (response instanceof BufferedClientHttpResponse buffered) {
      return buffered;
    }
    byte[] bytes;
    try {
      InputStream in = response.getBody();
      bytes = in == null ? new byte[0] : StreamUtils.copyToByteArray(in);
    } catch (IOException | RuntimeException e) {
      response.close();
      throw e;
    }
    return new BufferedClientHttpResponse(response, bytes);
  }

  byte[] bodyBytes() {
    return body;
  }

  @Override
  public HttpStatusCode getStatusCode() throws IOException {
    return response.getStatusCode();
  }

  @Override
  public String getStatusText() throws IOException {
    return response.getStatusText();
  }

  @Override
  public HttpHeaders getHeaders() {
    return response.getHeaders();
  }

  @Override
  public InputStream getBody() {
    return new ByteArrayInputStream(body);
  }

  @Override
  public void close() {
    response.close();
  }
}
