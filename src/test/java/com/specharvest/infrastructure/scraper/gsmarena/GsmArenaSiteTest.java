package com.specharvest.infrastructure.scraper.gsmarena;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GsmArenaSite URL building.
 */
class GsmArenaSiteTest {

    private final GsmArenaSite site = new GsmArenaSite("https://example.test");

    @Test
    void testListingPageUrls() {
        assertEquals("https://example.test/apple-phones-48.php", site.listingPageUrl("apple-phones-48", 1));
        assertEquals("https://example.test/apple-phones-f-48-0-p2.php", site.listingPageUrl("apple-phones-f-48-0", 2));
    }

    @Test
    void testAbsolute() {
        assertEquals("https://example.test/acme_x1-100.php", site.absolute("acme_x1-100.php"));
        assertEquals("https://example.test/acme_x1-100.php", site.absolute("/acme_x1-100.php"));
        assertEquals("https://cdn.example.test/a.jpg", site.absolute("https://cdn.example.test/a.jpg"));
    }

    @Test
    void testAbsoluteProtocolRelative() {
        assertEquals("https://fdn2.gsmarena.com/vv/bigpic/acme-x1.jpg",
            site.absolute("//fdn2.gsmarena.com/vv/bigpic/acme-x1.jpg"));
        assertEquals("http://fdn2.gsmarena.com/a.jpg",
            new GsmArenaSite("http://mirror.example.test/").absolute("//fdn2.gsmarena.com/a.jpg"));
    }

    @Test
    void testIdFromHref() {
        assertEquals("apple-phones-48", GsmArenaSite.idFromHref("apple-phones-48.php"));
        assertEquals("acme_x1-100", GsmArenaSite.idFromHref("https://example.test/acme_x1-100.php?ref=list"));
    }
}
