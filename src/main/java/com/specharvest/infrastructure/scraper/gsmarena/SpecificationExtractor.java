package com.specharvest.infrastructure.scraper.gsmarena;

import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.model.SpecPair;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.infrastructure.resilience.ResilientFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a device detail page into ordered categories of key/value pairs.
 *
 * <p>Each specification table starts with a header cell naming the category.
 * Rows carry the key in {@code td.ttl} and the value in {@code td.nfo}; a row
 * with a blank key continues the previous pair and its value is appended on a
 * new line.</p>
 */
public class SpecificationExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SpecificationExtractor.class);

    private final GsmArenaSite site;
    private final ResilientFetcher fetcher;

    public SpecificationExtractor(GsmArenaSite site, ResilientFetcher fetcher) {
        this.site = site;
        this.fetcher = fetcher;
    }

    public List<RawCategory> fetchSpecification(Channel channel, String detailId) throws FetchException {
        String url = site.detailUrl(detailId);
        String html = fetcher.withRetry("detail " + detailId, channel, c -> c.fetch(url));
        List<RawCategory> categories = parseSpecification(html);
        if (categories.isEmpty()) {
            logger.warn("No specification tables found for {}", detailId);
        }
        return categories;
    }

    static List<RawCategory> parseSpecification(String html) {
        List<RawCategory> categories = new ArrayList<>();

        for (Element table : Jsoup.parse(html).select("#specs-list table")) {
            Element header = table.selectFirst("th");
            if (header == null || cleanText(header).isEmpty()) {
                continue;
            }

            List<SpecPair> pairs = new ArrayList<>();
            for (Element row : table.select("tr")) {
                Element keyCell = row.selectFirst("td.ttl");
                Element valueCell = row.selectFirst("td.nfo");
                if (keyCell == null || valueCell == null) {
                    continue;
                }

                String key = cleanText(keyCell);
                String value = cleanText(valueCell);
                if (key.isEmpty()) {
                    if (!pairs.isEmpty()) {
                        SpecPair previous = pairs.remove(pairs.size() - 1);
                        pairs.add(new SpecPair(previous.key(), previous.value() + "\n" + value));
                    }
                    continue;
                }
                pairs.add(new SpecPair(key, value));
            }

            categories.add(new RawCategory(cleanText(header), pairs));
        }
        return categories;
    }

    private static String cleanText(Element element) {
        return element.text().replace('\u00a0', ' ').trim();
    }
}
