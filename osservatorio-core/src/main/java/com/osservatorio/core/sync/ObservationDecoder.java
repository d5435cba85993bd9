package com.osservatorio.core.sync;

import com.osservatorio.core.client.UpstreamResponse;
import com.osservatorio.data.analytics.Observation;

import java.util.List;

/**
 * Turns an upstream payload into observation rows. Payload formats differ per
 * dataflow, so callers supply the decoder with each sync job.
 */
@FunctionalInterface
public interface ObservationDecoder {

    List<Observation> decode(String datasetId, UpstreamResponse response);
}
