package org.normharvest;

import java.util.Map;

/**
 * Something the {@link Saver} writes to disk. Records are filed under year, type and situation and named
 * after their title and the last segment of {@link #fileUrl()}.
 */
public interface HarvestRecord {
    String title();

    int year();

    String type();

    String situation();

    String fileUrl();

    /**
     * The JSON object written for this record, fields in output order.
     */
    Map<String, Object> toJson();
}
