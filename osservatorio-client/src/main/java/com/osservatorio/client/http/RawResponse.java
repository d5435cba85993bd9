package com.osservatorio.client.http;

import lombok.Value;
import org.springframework.http.HttpHeaders;

@Value
public class RawResponse {
    int statusCode;
    HttpHeaders headers;
    byte[] body;

    public String contentType() {
        return headers.getContentType() != null ? headers.getContentType().toString() : null;
    }
}
