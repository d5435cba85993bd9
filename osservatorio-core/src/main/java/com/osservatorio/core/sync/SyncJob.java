package com.osservatorio.core.sync;

import com.osservatorio.core.client.FetchRequest;
import com.osservatorio.data.metadata.DatasetDescriptor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncJob {
    DatasetDescriptor descriptor;
    FetchRequest request;
    ObservationDecoder decoder;

    public String getDatasetId() {
        return descriptor.getDatasetId();
    }
}
