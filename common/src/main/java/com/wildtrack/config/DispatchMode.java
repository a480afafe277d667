package com.wildtrack.config;

/**
 * Selects the transport used to deliver observation batches downstream.
 */
public enum DispatchMode {

    /**
     * POST each batch as a JSON array to the sensors ingestion API.
     */
    HTTP,

    /**
     * Publish each observation of a batch to a Kafka topic, keyed by source.
     */
    KAFKA
}
