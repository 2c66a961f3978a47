package com.aboutblank.security;

import com.aboutblank.exception.ProblemDetails;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Rejects request bodies larger than the configured cap with 413.
 *
 * A declared Content-Length is checked up front. Bodies of unknown length
 * (chunked uploads) are read into memory up to one byte past the cap; if they
 * fit, the rest of the chain reads the buffered copy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestSizeLimitFilter extends OncePerRequestFilter {

    private final ObjectMapper objectMapper;

    @Value("${app.request.max-body-bytes:1048576}")
    private long maxBodyBytes;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        long contentLength = request.getContentLengthLong();

        if (contentLength > maxBodyBytes) {
            reject(request, response, contentLength);
            return;
        }

        if (contentLength < 0) {
            byte[] body = request.getInputStream().readNBytes((int) Math.min(maxBodyBytes + 1, Integer.MAX_VALUE));
            if (body.length > maxBodyBytes) {
                reject(request, response, contentLength);
                return;
            }
            filterChain.doFilter(new BufferedBodyRequest(request, body), response);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, long contentLength)
            throws IOException {
        log.warn("Rejected oversized request body: path={}, contentLength={}, limit={}",
                request.getRequestURI(), contentLength < 0 ? "unknown" : contentLength, maxBodyBytes);

        ProblemDetails.write(response, objectMapper, ProblemDetails.create(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "Payload Too Large",
                String.format("Request body must not exceed %d bytes.", maxBodyBytes),
                request.getRequestURI(),
                "payload-too-large"
        ));
    }

    /**
     * Replays a body that was already read from the client.
     */
    static class BufferedBodyRequest extends HttpServletRequestWrapper {

        private final byte[] body;

        BufferedBodyRequest(HttpServletRequest request, byte[] body) {
            super(request);
            this.body = body;
        }

        @Override
        public ServletInputStream getInputStream() {
            ByteArrayInputStream source = new ByteArrayInputStream(body);
            return new ServletInputStream() {
                @Override
                public int read() {
                    return source.read();
                }

                @Override
                public int read(byte[] b, int off, int len) {
                    return source.read(b, off, len);
                }

                @Override
                public boolean isFinished() {
                    return source.available() == 0;
                }

                @Override
                public boolean isReady() {
                    return true;
                }

                @Override
                public void setReadListener(ReadListener readListener) {
                    throw new UnsupportedOperationException("Buffered request bodies are read synchronously");
                }
            };
        }

        @Override
        public BufferedReader getReader() {
            String encoding = getCharacterEncoding();
            Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
            return new BufferedReader(new InputStreamReader(getInputStream(), charset));
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
