package org.normharvest;

/**
 * Where sources hand over their results. Implementations are safe to call from worker threads.
 */
public interface RecordSink {
    void accept(DocumentRecord record);

    void reject(ErrorRecord record);
}
