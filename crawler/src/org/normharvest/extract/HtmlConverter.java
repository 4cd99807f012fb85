package org.normharvest.extract;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * HTML to markdown: jsoup drops scripts and styles, flexmark writes the markdown.
 */
public class HtmlConverter {
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private final FlexmarkHtmlConverter converter;

    public HtmlConverter() {
        var options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        options.set(FlexmarkHtmlConverter.OUTPUT_ATTRIBUTES_ID, false);
        this.converter = FlexmarkHtmlConverter.builder(options).build();
    }

    public String toMarkdown(String html, List<String> boilerplate) {
        return convert(Jsoup.parse(html), boilerplate);
    }

    /**
     * Parses raw bytes, honouring the charset from the Content-Type header or the page's meta tag.
     */
    public String toMarkdown(byte[] html, @Nullable String charset, String baseUri, List<String> boilerplate)
            throws IOException {
        return convert(Jsoup.parse(new ByteArrayInputStream(html), charset, baseUri), boilerplate);
    }

    private String convert(Document document, List<String> boilerplate) {
        document.select("script, style, noscript, iframe").remove();
        String markdown = converter.convert(document.outerHtml());
        for (String snippet : boilerplate) {
            if (!snippet.isEmpty()) markdown = markdown.replace(snippet, "");
        }
        return EXCESS_BLANK_LINES.matcher(markdown).replaceAll("\n\n").strip();
    }
}
