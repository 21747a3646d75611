package com.specharvest.infrastructure.scraper.gsmarena;

import com.specharvest.domain.model.Brand;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.infrastructure.resilience.ResilientFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fetches the brand index page and extracts every brand in document order.
 */
public class BrandCatalogFetcher {

    private static final Logger logger = LoggerFactory.getLogger(BrandCatalogFetcher.class);
    private static final String BRAND_LINK_SELECTOR = "div.st-text table td a";

    private final GsmArenaSite site;
    private final ResilientFetcher fetcher;

    public BrandCatalogFetcher(GsmArenaSite site, ResilientFetcher fetcher) {
        this.site = site;
        this.fetcher = fetcher;
    }

    public List<Brand> fetchBrands(Channel channel) throws FetchException {
        String url = site.brandIndexUrl();
        logger.info("Fetching brand index from {}", url);
        String html = fetcher.withRetry("brand index", channel, c -> c.fetch(url));

        List<Brand> brands = parseBrands(html);
        if (brands.isEmpty()) {
            logger.warn("Brand index contained no brands, the page layout may have changed or the request was blocked");
        } else {
            logger.info("Found {} brands", brands.size());
        }
        return brands;
    }

    static List<Brand> parseBrands(String html) {
        Document document = Jsoup.parse(html);
        List<Brand> brands = new ArrayList<>();

        for (Element link : document.select(BRAND_LINK_SELECTOR)) {
            String href = link.attr("href");
            if (href.isBlank()) {
                continue;
            }
            brands.add(parseBrandLabel(link.text(), GsmArenaSite.idFromHref(href)));
        }
        return brands;
    }

    /**
     * Splits a label such as "Samsung 1385 devices" into name and count.
     * The label is split on whitespace; when there are at least two tokens and
     * the second-to-last parses as a non-negative integer, the tokens before it
     * form the name. Otherwise the whole label is the name and the count is 0.
     */
    static Brand parseBrandLabel(String label, String slug) {
        String[] tokens = label.trim().split("\\s+");
        if (tokens.length >= 2) {
            String countToken = tokens[tokens.length - 2];
            if (countToken.matches("\\d+")) {
                try {
                    int count = Integer.parseInt(countToken);
                    String name = String.join(" ", Arrays.copyOfRange(tokens, 0, tokens.length - 2));
                    return new Brand(name, slug, count);
                } catch (NumberFormatException e) {
                    logger.debug("Device count out of range in brand label '{}'", label);
                }
            }
        }
        return new Brand(label.trim(), slug, 0);
    }
}
