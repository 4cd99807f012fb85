package org.normharvest.source.conama;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.normharvest.DocumentRecord;
import org.normharvest.ErrorRecord;
import org.normharvest.RecordSink;
import org.normharvest.config.SourceConfig;
import org.normharvest.extract.DocumentExtractor;
import org.normharvest.http.EgressRotator;
import org.normharvest.http.HttpConfig;
import org.normharvest.http.ResilientHttpClient;
import org.normharvest.source.SourceContext;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ConamaSourceTest {
    private final ObjectMapper json = new ObjectMapper();
    private final ResilientHttpClient http = new ResilientHttpClient(new HttpConfig().withRetry(2, Duration.ZERO));
    private final List<String> listings = new CopyOnWriteArrayList<>();
    private HttpServer httpServer;

    @AfterEach
    void tearDown() {
        if (httpServer != null) httpServer.stop(0);
        http.close();
    }

    private ConamaSource source(String baseUrl) {
        var config = new SourceConfig(1984, 2, false, false, false, false, baseUrl, "CONAMA", null, null,
                Map.of("pageSize", "2"));
        var context = new SourceContext(ConamaSource.NAME, config, http, new DocumentExtractor(http, null, 2),
                null, null, EgressRotator.NONE, 2, () -> true);
        return new ConamaSource(context);
    }

    private static Map<String, String> query(HttpExchange exchange) {
        var params = new HashMap<String, String>();
        String query = exchange.getRequestURI().getQuery();
        if (query == null) return params;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) params.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    private ObjectNode row(int id) {
        return json.createObjectNode()
                .put("aid", String.valueOf(id))
                .put("nomeato", "Resolução")
                .put("numero", String.valueOf(id))
                .put("ano", "2020")
                .put("descricao", "Ementa da resolução " + id)
                .put("status", "Publicada")
                .put("palavra_chave", "licenciamento")
                .put("porigem", "CONAMA");
    }

    /**
     * Three resolutions in 2020, listed two per page. The third has no downloadable file.
     */
    private String serveFixture(boolean listingFails) throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        httpServer.createContext("/", exchange -> {
            Map<String, String> params = query(exchange);
            if ("atosnormativos.getList".equals(params.get("task"))) {
                listings.add(params.get("tipo") + "/" + params.get("ano") + "@" + params.get("offset"));
                if (listingFails) {
                    respond(exchange, 500, "text/plain", "error");
                    return;
                }
                var rows = json.createArrayNode();
                int total = 0;
                if ("1".equals(params.get("tipo")) && "2020".equals(params.get("ano"))) {
                    total = 3;
                    int offset = Integer.parseInt(params.get("offset"));
                    for (int id = offset + 1; id <= Math.min(total, offset + 2); id++) {
                        rows.add(row(id));
                    }
                }
                ObjectNode body = json.createObjectNode();
                body.putObject("data").put("total", total).set("rows", rows);
                respond(exchange, 200, "application/json", json.writeValueAsString(body));
            } else if ("arquivo.download".equals(params.get("task")) && !"3".equals(params.get("id"))) {
                respond(exchange, 200, "text/html; charset=utf-8",
                        "<html><body><h1>RESOLUÇÃO Nº " + params.get("id") + "</h1><p>Art. 1º</p></body></html>");
            } else {
                respond(exchange, 404, "text/plain", "not found");
            }
        });
        httpServer.start();
        return "http://127.0.0.1:" + httpServer.getAddress().getPort() + "/";
    }

    @Test
    void urls() {
        var source = source("https://conama.mma.gov.br/");
        assertEquals("https://conama.mma.gov.br/?option=com_sisconama&order=asc&offset=4&limit=2" +
                     "&task=atosnormativos.getList&tipo=6&ano=1984", source.formatSearchUrl("Portaria", 1984, 4));
        assertEquals("https://conama.mma.gov.br/?option=com_sisconama&task=arquivo.download&id=771",
                source.downloadUrl("771"));
    }

    @Test
    void title() {
        assertEquals("Resolução CONAMA Nº 501/2021", ConamaSource.title(json.createObjectNode()
                .put("nomeato", "Resolução").put("numero", "501").put("ano", "2021")));
    }

    @Test
    void titleWithMissingFields() {
        assertEquals("Moção CONAMA Nº /2019", ConamaSource.title(json.createObjectNode()
                .put("nomeato", "Moção").putNull("numero").put("ano", "2019")));
        assertEquals(" CONAMA Nº /", ConamaSource.title(json.createObjectNode()));
    }

    @Test
    void followsPagination() throws Exception {
        var source = source(serveFixture(false));
        List<?> rows = source.getDocsLinks("Resolução", 2020);
        assertEquals(3, rows.size());
        assertEquals(List.of("1/2020@0", "1/2020@2"), listings);
    }

    @Test
    void scrapesYear() throws Exception {
        var source = source(serveFixture(false));
        var accepted = new CopyOnWriteArrayList<DocumentRecord>();
        var rejected = new CopyOnWriteArrayList<ErrorRecord>();
        source.scrapeYear(2020, new RecordSink() {
            @Override
            public void accept(DocumentRecord record) {
                accepted.add(record);
            }

            @Override
            public void reject(ErrorRecord record) {
                rejected.add(record);
            }
        });

        // one listing per type, plus the second page of resolutions
        assertEquals(ConamaSource.TYPES.size() + 1, listings.size());

        assertEquals(2, accepted.size());
        DocumentRecord first = accepted.get(0);
        assertEquals("Resolução CONAMA Nº 1/2020", first.title());
        assertEquals(2020, first.year());
        assertEquals("Resolução", first.type());
        assertEquals("Não consta", first.situation());
        assertEquals("Ementa da resolução 1", first.summary());
        assertTrue(first.textMarkdown().contains("RESOLUÇÃO Nº 1"), first.textMarkdown());
        assertTrue(first.documentUrl().endsWith("task=arquivo.download&id=1"));
        assertEquals("licenciamento", first.extra().get("keyword"));
        assertEquals("Publicada", first.extra().get("status"));
        assertEquals("Resolução CONAMA Nº 2/2020", accepted.get(1).title());

        assertEquals(1, rejected.size());
        ErrorRecord error = rejected.get(0);
        assertEquals("Resolução CONAMA Nº 3/2020", error.title());
        assertTrue(error.documentUrl().endsWith("id=3"));
        assertEquals("3", error.extra().get("id"));
    }

    @Test
    void failedListingAbortsYear() throws Exception {
        var source = source(serveFixture(true));
        var accepted = new CopyOnWriteArrayList<DocumentRecord>();
        assertThrows(IOException.class, () -> source.scrapeYear(2020, new RecordSink() {
            @Override
            public void accept(DocumentRecord record) {
                accepted.add(record);
            }

            @Override
            public void reject(ErrorRecord record) {
                fail("unexpected error record " + record);
            }
        }));
        assertEquals(1, listings.size());
        assertTrue(accepted.isEmpty());
    }
}
