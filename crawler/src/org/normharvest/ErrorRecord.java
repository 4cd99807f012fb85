package org.normharvest;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A norm that was found but could not be harvested, kept for manual triage.
 */
public record ErrorRecord(
        String title,
        int year,
        String type,
        String situation,
        @Nullable String htmlLink,
        @Nullable String documentUrl,
        String error,
        Map<String, Object> extra) implements HarvestRecord {

    public ErrorRecord {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(situation, "situation");
        if (error == null) error = "unknown error";
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * The error record for a document whose file could not be written.
     */
    public static ErrorRecord failedWrite(DocumentRecord record, String error) {
        return new ErrorRecord(record.title(), record.year(), record.type(), record.situation(), null,
                record.documentUrl(), "Failed to save document: " + error, record.extra());
    }

    @Override
    public String fileUrl() {
        if (documentUrl != null) return documentUrl;
        return htmlLink != null ? htmlLink : "";
    }

    @Override
    public Map<String, Object> toJson() {
        var json = new LinkedHashMap<String, Object>();
        json.put("title", title);
        json.put("year", year);
        json.put("type", type);
        json.put("situation", situation);
        json.put("html_link", htmlLink);
        json.put("document_url", documentUrl);
        json.put("error", error);
        extra.forEach(json::putIfAbsent);
        return json;
    }
}
