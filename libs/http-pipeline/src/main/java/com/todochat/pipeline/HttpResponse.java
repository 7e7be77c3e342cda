package com.todochat.pipeline;

/**
 * Outbound response travelling back through the pipeline. Stages may change status, headers and
 * body on the way out.
 * <p>
 * The body is either raw bytes already encoded by the handler, or a structured value (a record, a
 * map) that the transport serializes, typically as JSON.
 */
public final class HttpResponse {

    private int status;
    private final HttpHeaders headers;
    private Object body;

    public HttpResponse(int status, HttpHeaders headers, Object body) {
        this.status = validStatus(status);
        this.headers = headers == null ? new HttpHeaders() : headers;
        this.body = body;
    }

    /** Creates a response with the given status and no body. */
    public static HttpResponse withStatus(int status) {
        return new HttpResponse(status, new HttpHeaders(), null);
    }

    /** Creates a 200 response carrying a structured body. */
    public static HttpResponse ok(Object body) {
        return new HttpResponse(200, new HttpHeaders(), body);
    }

    /** Creates a response with the given status carrying a structured body. */
    public static HttpResponse of(int status, Object body) {
        return new HttpResponse(status, new HttpHeaders(), body);
    }

    public int status() {
        return status;
    }

    public HttpResponse status(int newStatus) {
        this.status = validStatus(newStatus);
        return this;
    }

    /** Mutable headers of this response. */
    public HttpHeaders headers() {
        return headers;
    }

    /** Shortcut for {@code headers().set(name, value)}. */
    public HttpResponse header(String name, String value) {
        headers.set(name, value);
        return this;
    }

    public Object body() {
        return body;
    }

    public HttpResponse body(Object newBody) {
        this.body = newBody;
        return this;
    }

    private static int validStatus(int status) {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status must be between 100 and 599: " + status);
        }
        return status;
    }

    @Override
    public String toString() {
        return "HttpResponse[status=" + status + ", headers=" + headers + "]";
    }
}
