package org.normharvest;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A harvested norm, immutable once built.
 *
 * @param title        display title, e.g. "Resolução CONAMA Nº 501/2021"
 * @param year         publication year
 * @param type         norm type as the source names it
 * @param situation    validity state as published, or inferred when the source has none
 * @param summary      the source's summary (ementa), if any
 * @param textMarkdown document text converted to markdown
 * @param htmlString   raw document HTML, for sources whose text is kept as published
 * @param documentUrl  where the document text was fetched from
 * @param extra        source specific fields, written after the common ones
 */
public record DocumentRecord(
        String title,
        int year,
        String type,
        String situation,
        @Nullable String summary,
        @Nullable String textMarkdown,
        @Nullable String htmlString,
        String documentUrl,
        Map<String, Object> extra) implements HarvestRecord {

    public DocumentRecord {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(situation, "situation");
        Objects.requireNonNull(documentUrl, "documentUrl");
        if (textMarkdown == null && htmlString == null) {
            throw new IllegalArgumentException("record needs text_markdown or html_string: " + title);
        }
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static DocumentRecord markdown(String title, int year, String type, String situation,
                                          @Nullable String summary, String textMarkdown, String documentUrl,
                                          Map<String, Object> extra) {
        return new DocumentRecord(title, year, type, situation, summary, textMarkdown, null, documentUrl, extra);
    }

    @Override
    public String fileUrl() {
        return documentUrl;
    }

    @Override
    public Map<String, Object> toJson() {
        var json = new LinkedHashMap<String, Object>();
        json.put("title", title);
        json.put("year", year);
        json.put("type", type);
        json.put("situation", situation);
        json.put("summary", summary);
        if (textMarkdown != null) json.put("text_markdown", textMarkdown);
        if (htmlString != null) json.put("html_string", htmlString);
        json.put("document_url", documentUrl);
        extra.forEach(json::putIfAbsent);
        return json;
    }
}
