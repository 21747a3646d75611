package com.specharvest.infrastructure.scraper.gsmarena;

import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.support.CancellationToken;
import com.specharvest.infrastructure.resilience.ResilientFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the paginated device listing of one brand.
 *
 * <p>Pages are requested in order until a page adds no new device, the
 * optional limit is reached or a page after the first fails to load. A
 * failure on the first page, credential exhaustion and cancellation are
 * propagated to the caller.</p>
 */
public class ListingPaginator {

    private static final Logger logger = LoggerFactory.getLogger(ListingPaginator.class);
    private static final String ITEM_LINK_SELECTOR = "div.makers ul li a";

    private final GsmArenaSite site;
    private final ResilientFetcher fetcher;
    private final CancellationToken cancellation;
    private final Duration pageDelay;

    public ListingPaginator(GsmArenaSite site, ResilientFetcher fetcher, CancellationToken cancellation, Duration pageDelay) {
        this.site = site;
        this.fetcher = fetcher;
        this.cancellation = cancellation;
        this.pageDelay = pageDelay;
    }

    /**
     * @param limit maximum number of items to return, or null for all
     */
    public List<ListingItem> fetchListing(Channel channel, String brandSlug, Integer limit) throws FetchException {
        List<ListingItem> items = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int page = 1; limit == null || items.size() < limit; page++) {
            if (page > 1 && !cancellation.pause(pageDelay)) {
                throw FetchException.cancelled();
            }

            String url = site.listingPageUrl(brandSlug, page);
            String html;
            try {
                html = fetcher.withRetry("listing " + brandSlug + " page " + page, channel, c -> c.fetch(url));
            } catch (FetchException e) {
                if (page == 1 || e.isTerminal()) {
                    throw e;
                }
                logger.debug("Stopping pagination of {} at page {}: {}", brandSlug, page, e.getMessage());
                break;
            }

            int before = items.size();
            for (ListingItem item : parseListingPage(html)) {
                if (limit != null && items.size() >= limit) {
                    break;
                }
                if (seen.add(item.detailId())) {
                    items.add(item);
                }
            }

            if (items.size() == before) {
                break;
            }
            logger.debug("Listing {} page {}: {} items so far", brandSlug, page, items.size());
        }

        logger.info("Found {} items for {}", items.size(), brandSlug);
        return items;
    }

    List<ListingItem> parseListingPage(String html) {
        List<ListingItem> items = new ArrayList<>();
        for (Element link : Jsoup.parse(html).select(ITEM_LINK_SELECTOR)) {
            String href = link.attr("href");
            if (href.isBlank()) {
                continue;
            }

            String thumbnail = null;
            Element image = link.selectFirst("img");
            if (image != null && !image.attr("src").isBlank()) {
                thumbnail = site.absolute(image.attr("src"));
            }

            items.add(new ListingItem(
                link.text().trim(),
                GsmArenaSite.idFromHref(href),
                site.absolute(href),
                thumbnail));
        }
        return items;
    }
}
