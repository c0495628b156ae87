package com.mirrorwatch.common.parser;

import com.mirrorwatch.common.exception.MarkupParseException;
import com.mirrorwatch.common.model.AboutVersion;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Pattern;

/**
 * Reads the version link from an instance's about page: the first {@code <a>} inside
 * the first {@code <p>} mentioning "Version".
 */
public class AboutParser {

    /** Semantic version or a commit-like token of at least seven characters. */
    static final Pattern VERSION_PATTERN =
        Pattern.compile("^((\\d+\\.\\d+\\.\\d+)|[a-zA-Z0-9]{7,})", Pattern.CASE_INSENSITIVE);

    public AboutVersion parse(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);

        Element paragraph = document.select("p").stream()
            .filter(p -> p.text().contains("Version"))
            .findFirst()
            .orElseThrow(() -> new MarkupParseException("No paragraph containing a version found"));

        Element link = paragraph.selectFirst("a");
        if (link == null) {
            throw new MarkupParseException("No version link found");
        }
        String href = link.attr("href").trim();
        if (href.isEmpty()) {
            throw new MarkupParseException("Version link has no href");
        }
        String text = link.text().trim();
        if (!VERSION_PATTERN.matcher(text).find()) {
            throw new MarkupParseException("Unexpected version format: '" + text + "'");
        }
        return new AboutVersion(text, href);
    }
}
