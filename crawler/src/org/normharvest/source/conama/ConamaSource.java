package org.normharvest.source.conama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.normharvest.DocumentRecord;
import org.normharvest.ErrorRecord;
import org.normharvest.RecordSink;
import org.normharvest.source.SourceAdapter;
import org.normharvest.source.SourceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conselho Nacional do Meio Ambiente (https://conama.mma.gov.br/atos-normativos-sistema).
 * <p>
 * The site has a JSON search API listing acts by type and year, e.g.
 * {@code ?option=com_sisconama&order=asc&offset=0&limit=100&task=atosnormativos.getList&tipo=6&ano=1984},
 * and serves each act's PDF from {@code ?option=com_sisconama&task=arquivo.download&id={aid}}.
 * CONAMA publishes no validity field, so every act is filed as "Não consta"; revocations are only stated in the
 * text itself.
 */
public class ConamaSource implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ConamaSource.class);
    public static final String NAME = "conama";
    static final Map<String, Integer> TYPES = types();
    static final List<String> SITUATIONS = List.of("Não consta");
    static final int DEFAULT_PAGE_SIZE = 100;
    private static final ObjectMapper JSON = new ObjectMapper();
    private final SourceContext context;
    private final URI baseUri;
    private final int pageSize;

    public ConamaSource(SourceContext context) {
        this.context = context;
        this.baseUri = URI.create(context.baseUrl());
        this.pageSize = Integer.parseInt(context.config().option("pageSize", String.valueOf(DEFAULT_PAGE_SIZE)));
    }

    private static Map<String, Integer> types() {
        var types = new LinkedHashMap<String, Integer>();
        types.put("Resolução", 1);
        types.put("Moção", 2);
        types.put("Recomendação", 3);
        types.put("Proposição", 4);
        types.put("Decisão", 5);
        types.put("Portaria", 6);
        return types;
    }

    String formatSearchUrl(String type, int year, int offset) {
        return baseUri.resolve("?option=com_sisconama&order=asc&offset=" + offset + "&limit=" + pageSize +
                               "&task=atosnormativos.getList&tipo=" + TYPES.get(type) + "&ano=" + year).toString();
    }

    String downloadUrl(String id) {
        return baseUri.resolve("?option=com_sisconama&task=arquivo.download&id=" + id).toString();
    }

    /**
     * Lists every act of a type published in a year, following the API's offset pagination.
     *
     * @throws IOException if a listing page can't be fetched; the year would otherwise be silently incomplete
     */
    List<JsonNode> getDocsLinks(String type, int year) throws IOException {
        var rows = new ArrayList<JsonNode>();
        int offset = 0;
        int total;
        do {
            String url = formatSearchUrl(type, year, offset);
            var response = context.http().get(url);
            if (response == null || response.statusCode() != 200) {
                throw new IOException("Couldn't list " + type + " " + year + " from " + url +
                                      (response == null ? "" : " (status " + response.statusCode() + ")"));
            }
            JsonNode data = JSON.readTree(response.body()).path("data");
            total = data.path("total").asInt(0);
            JsonNode page = data.path("rows");
            if (!page.isArray() || page.isEmpty()) break;
            page.forEach(rows::add);
            offset += pageSize;
        } while (offset < total);
        return rows;
    }

    /**
     * Downloads one act and builds its record.
     *
     * @return null if no text could be extracted
     */
    @Nullable
    DocumentRecord getDocData(JsonNode row, int year, String type, String situation) {
        String id = row.path("aid").asText();
        String url = downloadUrl(id);
        String markdown = context.extractor().toMarkdown(url, context.config().boilerplate());
        if (markdown == null) return null;
        return DocumentRecord.markdown(title(row), year, type, situation, text(row, "descricao"), markdown, url,
                extra(row));
    }

    /**
     * e.g. "Resolução CONAMA Nº 501/2021"
     */
    static String title(JsonNode row) {
        return textOrEmpty(row, "nomeato") + " CONAMA Nº " + textOrEmpty(row, "numero") + "/"
               + textOrEmpty(row, "ano");
    }

    private static Map<String, Object> extra(JsonNode row) {
        var extra = new LinkedHashMap<String, Object>();
        extra.put("id", text(row, "aid"));
        extra.put("number", text(row, "numero"));
        extra.put("status", text(row, "status"));
        extra.put("keyword", text(row, "palavra_chave"));
        extra.put("origin", text(row, "porigem"));
        return extra;
    }

    private static String textOrEmpty(JsonNode row, String field) {
        String value = text(row, field);
        return value == null ? "" : value;
    }

    private static @Nullable String text(JsonNode row, String field) {
        JsonNode value = row.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public void scrapeYear(int year, RecordSink sink) throws Exception {
        for (String situation : SITUATIONS) {
            for (String type : TYPES.keySet()) {
                if (!context.isRunning()) return;
                List<JsonNode> rows = getDocsLinks(type, year);
                List<DocumentRecord> records = context.fanOut("docs", rows, row -> {
                    try {
                        return getDocData(row, year, type, situation);
                    } catch (RuntimeException e) {
                        log.warn("Error processing {} {}: {}", type, row.path("aid").asText(), e.toString());
                        return null;
                    }
                });
                int saved = 0;
                for (int i = 0; i < rows.size(); i++) {
                    DocumentRecord record = records.get(i);
                    if (record != null) {
                        sink.accept(record);
                        saved++;
                    } else {
                        JsonNode row = rows.get(i);
                        sink.reject(new ErrorRecord(title(row), year, type, situation,
                                formatSearchUrl(type, year, 0), downloadUrl(row.path("aid").asText()),
                                "No text could be extracted from the document", extra(row)));
                    }
                }
                log.atDebug().addKeyValue("year", year).addKeyValue("type", type)
                        .log("CONAMA {} {}: {} of {} documents", type, year, saved, rows.size());
            }
        }
    }
}
