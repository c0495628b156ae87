package com.mirrorwatch.common.parser;

import com.mirrorwatch.common.exception.MarkupParseException;
import com.mirrorwatch.common.model.ListedInstance;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the rendered wiki page listing public instances.
 *
 * <p>Expected layout: a {@code div#wiki-body} containing a table whose text mentions
 * "Online". Each body row holds the instance link in its first cell followed by at
 * least four cells: online marker, SSL column, country, provider. Rows that do not
 * fit are skipped so that small edits to the wiki do not break the whole listing.
 */
public class InstanceListParser {

    private static final Logger log = LoggerFactory.getLogger(InstanceListParser.class);

    static final int MIN_TRAILING_CELLS = 4;
    static final int COUNTRY_CELL       = 2;

    /**
     * @return listed instances keyed by normalized domain, in document order
     * @throws MarkupParseException when no wiki body or no instance table is present
     */
    public Map<String, ListedInstance> parse(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);

        Element wikiBody = document.selectFirst("div#wiki-body");
        if (wikiBody == null) {
            throw new MarkupParseException("No div #wiki-body found in instance list");
        }
        Element table = wikiBody.select("table").stream()
            .filter(t -> t.text().contains("Online"))
            .findFirst()
            .orElseThrow(() -> new MarkupParseException("No table containing instances found"));

        Map<String, ListedInstance> instances = new LinkedHashMap<>();
        int skipped = 0;
        for (Element row : table.select("tbody > tr")) {
            ListedInstance instance = parseRow(row);
            if (instance == null) {
                skipped++;
                continue;
            }
            if (instances.put(instance.domain(), instance) != null) {
                log.warn("Duplicate instance domain in listing. domain={}", instance.domain());
            }
        }
        log.debug("Instance list parsed. instances={} skippedRows={}", instances.size(), skipped);
        return instances;
    }

    private ListedInstance parseRow(Element row) {
        Elements cells = row.select("td");
        if (cells.isEmpty()) {
            return null;
        }
        Element link = cells.get(0).selectFirst("a[href]");
        if (link == null) {
            log.warn("Instance row without link, skipping. row={}", row.text());
            return null;
        }
        String href   = link.attr("href").trim();
        String domain = HostNames.normalize(href);
        String url    = HostNames.toBaseUrl(href);
        if (domain == null || url == null) {
            log.warn("Instance row with unusable URL, skipping. href={}", href);
            return null;
        }
        if (cells.size() - 1 < MIN_TRAILING_CELLS) {
            log.warn("Instance row missing fields, skipping. domain={} cells={}", domain, cells.size());
            return null;
        }
        String country = cells.get(1 + COUNTRY_CELL).text().trim();
        return new ListedInstance(domain, url, country, false, false);
    }
}
