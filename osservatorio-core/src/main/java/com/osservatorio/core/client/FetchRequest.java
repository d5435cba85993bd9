package com.osservatorio.core.client;

import com.osservatorio.common.concurrent.CancellationSignal;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * One upstream GET on behalf of a caller identifier.
 */
@Value
@Builder(toBuilder = true)
public class FetchRequest {
    String identifier;
    String path;
    @Builder.Default
    Map<String, String> query = Map.of();
    @Builder.Default
    Map<String, String> headers = Map.of();
    // rate-limit scope; null uses the configured default
    String scope;
    // skip the fresh cache lookup
    boolean fresh;
    @Builder.Default
    boolean allowStale = true;
    // cache TTL override; null uses the configured default
    Duration cacheTtl;
    @Builder.Default
    CancellationSignal cancellation = CancellationSignal.none();
}
