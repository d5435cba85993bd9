package com.osservatorio.core.client;

import lombok.Value;

/**
 * Result of one request of a batch fetch: a response or the error that ended it.
 */
@Value
public class FetchOutcome {
    FetchRequest request;
    UpstreamResponse response;
    RuntimeException error;

    public boolean isSuccess() {
        return response != null;
    }
}
