package com.example.emojinotifier.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects interaction requests whose {@code X-Signature-Ed25519} does not match the body. The body
 * is buffered once and replayed to the controller.
 */
public class InteractionSignatureFilter extends OncePerRequestFilter {

  static final String SIGNATURE_HEADER = "X-Signature-Ed25519";
  static final String TIMESTAMP_HEADER = "X-Signature-Timestamp";

  private static final Logger log = LoggerFactory.getLogger(InteractionSignatureFilter.class);

  private final InteractionSignatureVerifier verifier;
  private final ObjectMapper objectMapper;

  public InteractionSignatureFilter(
      InteractionSignatureVerifier verifier, ObjectMapper objectMapper) {
    this.verifier = verifier;
    this.objectMapper = objectMapper;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final byte[] body = request.getInputStream().readAllBytes();
    final boolean valid =
        verifier.verify(
            request.getHeader(SIGNATURE_HEADER), request.getHeader(TIMESTAMP_HEADER), body);
    if (!valid) {
      log.warn(
          "interaction rejected: invalid signature path={} client={}",
          request.getRequestURI(),
          request.getRemoteAddr());
      response.setStatus(HttpStatus.UNAUTHORIZED.value());
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getOutputStream(),
          new ApiErrorResponse("INTERACTION_SIGNATURE_INVALID", "invalid request signature"));
      return;
    }
    filterChain.doFilter(new BufferedBodyRequest(request, body), response);
  }

  private static final class BufferedBodyRequest extends HttpServletRequestWrapper {

    private final byte[] body;

    BufferedBodyRequest(HttpServletRequest request, byte[] body) {
      super(request);
      this.body = body;
    }

    @Override
    public ServletInputStream getInputStream() {
      final ByteArrayInputStream input = new ByteArrayInputStream(body);
      return new ServletInputStream() {
        @Override
        public boolean isFinished() {
          return input.available() == 0;
        }

        @Override
        public boolean isReady() {
          return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
          throw new UnsupportedOperationException("async reads are not supported");
        }

        @Override
        public int read() {
          return input.read();
        }
      };
    }

    @Override
    public BufferedReader getReader() {
      return new BufferedReader(new InputStreamReader(getInputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public int getContentLength() {
      return body.length;
    }

    @Override
    public long getContentLengthLong() {
      return body.length;
    }
  }
}
