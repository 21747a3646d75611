package com.specharvest.infrastructure.scraper.gsmarena;

/**
 * URL layout of the catalog site.
 */
public class GsmArenaSite {

    public static final String DEFAULT_BASE_URL = "https://www.gsmarena.com/";
    public static final String SOURCE_NAME = "gsmarena";

    private final String baseUrl;

    public GsmArenaSite(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String brandIndexUrl() {
        return baseUrl + "makers.php3";
    }

    /**
     * Page 1 is {@code {slug}.php}, later pages are {@code {slug}-p{page}.php}.
     */
    public String listingPageUrl(String brandSlug, int page) {
        return page <= 1
            ? baseUrl + brandSlug + ".php"
            : baseUrl + brandSlug + "-p" + page + ".php";
    }

    public String detailUrl(String detailId) {
        return baseUrl + detailId + ".php";
    }

    /**
     * Resolves a site-relative or protocol-relative link; absolute links are returned unchanged.
     */
    public String absolute(String href) {
        if (href.startsWith("http://") || href.startsWith("https://")) {
            return href;
        }
        if (href.startsWith("//")) {
            return baseUrl.substring(0, baseUrl.indexOf(':') + 1) + href;
        }
        return baseUrl + (href.startsWith("/") ? href.substring(1) : href);
    }

    /**
     * Returns the last path segment of a link without its ".php" extension,
     * e.g. "apple-phones-48.php" becomes "apple-phones-48".
     */
    public static String idFromHref(String href) {
        String path = href;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int slash = path.lastIndexOf('/');
        if (slash >= 0) {
            path = path.substring(slash + 1);
        }
        return path.endsWith(".php") ? path.substring(0, path.length() - ".php".length()) : path;
    }
}
