package org.normharvest.extract;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jetbrains.annotations.Nullable;
import org.normharvest.http.ResilientHttpClient;
import org.normharvest.http.RetryPolicy;
import org.normharvest.util.Workers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns fetched documents into markdown text.
 * <p>
 * PDFs are read natively first. When that yields too little text the PDF is taken to be a scan: every page is
 * rendered and sent to the {@link PageRecognizer} in parallel, and the page texts are joined back in page order.
 */
public class DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(DocumentExtractor.class);
    static final int MIN_NATIVE_TEXT_LENGTH = 200;
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final String PAGE_SEPARATOR = "\n\n";
    private final ResilientHttpClient http;
    private final @Nullable PageRecognizer recognizer;
    private final int maxWorkers;
    private final HtmlConverter htmlConverter = new HtmlConverter();
    private final RetryPolicy conversionRetry = RetryPolicy.fixed("conversion", 2, Duration.ZERO);

    public DocumentExtractor(ResilientHttpClient http, @Nullable PageRecognizer recognizer, int maxWorkers) {
        this.http = http;
        this.recognizer = recognizer;
        this.maxWorkers = maxWorkers;
    }

    public boolean isOcrEnabled() {
        return recognizer != null;
    }

    public String htmlToMarkdown(String html, List<String> boilerplate) {
        return htmlConverter.toMarkdown(html, boilerplate);
    }

    /**
     * @return the document text, or null if neither text extraction nor OCR produced anything
     */
    public @Nullable String pdfToMarkdown(byte[] pdf) throws IOException {
        try (PDDocument document = PDDocument.load(pdf)) {
            String nativeText = new PDFTextStripper().getText(document).strip();
            if (nativeText.length() > MIN_NATIVE_TEXT_LENGTH) {
                return nativeText;
            }
            if (recognizer == null) {
                log.debug("PDF has {} chars of text and OCR is disabled", nativeText.length());
                return nativeText.isEmpty() ? null : nativeText;
            }

            log.debug("PDF has {} chars of text, running OCR on {} pages", nativeText.length(),
                    document.getNumberOfPages());
            List<byte[]> pages = renderPages(document);
            String ocrText = recognizePages(pages);
            String text = nativeText.isEmpty() ? ocrText : ocrText.isEmpty() ? nativeText :
                    nativeText + PAGE_SEPARATOR + ocrText;
            return text.isBlank() ? null : text;
        }
    }

    /**
     * Renders at scale 1 in RGB. PDFRenderer isn't thread safe so this happens before the fan-out.
     */
    private static List<byte[]> renderPages(PDDocument document) throws IOException {
        var renderer = new PDFRenderer(document);
        var pages = new ArrayList<byte[]>(document.getNumberOfPages());
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            BufferedImage image = renderer.renderImage(i, 1f, ImageType.RGB);
            var png = new ByteArrayOutputStream();
            ImageIO.write(image, "png", png);
            pages.add(png.toByteArray());
        }
        return pages;
    }

    private String recognizePages(List<byte[]> pages) throws IOException {
        List<Integer> pageIndexes = IntStream.range(0, pages.size()).boxed().collect(Collectors.toList());
        List<String> texts;
        try {
            // results come back in input order whatever order the pages finish in
            texts = Workers.fanOut("ocr", maxWorkers, pageIndexes, i -> recognizePage(pages.get(i), i + 1));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException ioe) throw ioe;
            throw new IOException("OCR failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during OCR");
        }
        return texts.stream()
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(PAGE_SEPARATOR));
    }

    /**
     * The model sometimes returns nothing for a readable page, so an empty answer is retried once.
     */
    private String recognizePage(byte[] png, int pageNumber) throws IOException {
        String text = recognizer.recognize(png, pageNumber);
        if (text == null || text.isBlank()) {
            log.debug("Empty OCR result for page {}, retrying", pageNumber);
            text = recognizer.recognize(png, pageNumber);
        }
        if (text == null || text.isBlank()) {
            log.warn("No text recognised on page {}", pageNumber);
            return "";
        }
        return text.strip();
    }

    /**
     * Fetches {@code url} and converts it according to its type. Conversion is attempted twice.
     *
     * @return the markdown, or null if the document could not be fetched or held no text
     */
    public @Nullable String toMarkdown(String url) {
        return toMarkdown(url, List.of());
    }

    public @Nullable String toMarkdown(String url, List<String> boilerplate) {
        try {
            return conversionRetry.call(attempt -> {
                HttpResponse<byte[]> response = http.get(url);
                if (response == null) throw new IOException("no response");
                if (response.statusCode() >= 400) throw new IOException("status " + response.statusCode());
                String markdown = toMarkdown(response, boilerplate);
                if (markdown == null || markdown.isBlank()) throw new IOException("no text");
                return markdown;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            log.warn("Couldn't get markdown from {}: {}", url, e.getMessage());
            return null;
        }
    }

    /**
     * Converts an already fetched response, choosing PDF or HTML by content type or the PDF magic bytes.
     */
    public @Nullable String toMarkdown(HttpResponse<byte[]> response, List<String> boilerplate) throws IOException {
        byte[] body = response.body();
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (contentType.contains("application/pdf") || isPdf(body)) {
            return pdfToMarkdown(body);
        }
        return htmlConverter.toMarkdown(body, charset(contentType), response.uri().toString(), boilerplate);
    }

    static boolean isPdf(byte[] body) {
        if (body == null || body.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (body[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }

    static @Nullable String charset(String contentType) {
        int index = contentType.indexOf("charset=");
        if (index < 0) return null;
        String charset = contentType.substring(index + "charset=".length());
        int end = charset.indexOf(';');
        if (end >= 0) charset = charset.substring(0, end);
        charset = charset.replace("\"", "").trim();
        return charset.isEmpty() ? null : charset;
    }
}
