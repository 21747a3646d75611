package com.specharvest.domain.service;

import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.model.SpecComparison;
import com.specharvest.domain.model.SpecPair;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SpecificationReport.
 */
class SpecificationReportTest {

    private static final List<RawCategory> ACME_X1 = List.of(
        new RawCategory("Display", List.of(
            new SpecPair("Type", "IPS LCD"),
            new SpecPair("Size", "6.1 inches"),
            new SpecPair("Resolution", "1170 x 2532 pixels"))),
        new RawCategory("Platform", List.of(new SpecPair("Chipset", "Acme A1 (4 nm)"))),
        new RawCategory("Main Camera", List.of(new SpecPair("Dual", "48 MP, wide\n12 MP, ultrawide"))),
        new RawCategory("Battery", List.of(new SpecPair("Type", "Li-Ion 3349 mAh")))
    );

    private static final List<RawCategory> ZETA_Z = List.of(
        new RawCategory("Platform", List.of(new SpecPair("Chipset", "Zeta Z9"))),
        new RawCategory("Memory", List.of(new SpecPair("Internal", "128GB 8GB RAM"))),
        new RawCategory("Misc", List.of(new SpecPair("Price", "$ 299.99")))
    );

    @Test
    void testFindSpecMatchesKeyFragment() {
        assertEquals(Optional.of("1170 x 2532 pixels"), SpecificationReport.findSpec(ACME_X1, "resol"));
        assertEquals(Optional.of("Acme A1 (4 nm)"), SpecificationReport.findSpec(ACME_X1, "CHIPSET"));
        assertTrue(SpecificationReport.findSpec(ACME_X1, "nfc").isEmpty());
    }

    @Test
    void testFindSpecReturnsFirstMatchInPageOrder() {
        assertEquals(Optional.of("IPS LCD"), SpecificationReport.findSpec(ACME_X1, "type"));
        assertEquals(Optional.of("Li-Ion 3349 mAh"), SpecificationReport.findSpec(ACME_X1, "battery", "type"));
    }

    @Test
    void testCompareReadsNormalizedSections() {
        SpecComparison comparison = SpecificationReport.compare(record("Acme X1", ACME_X1), record("Zeta Z", ZETA_Z));

        assertEquals("Acme X1", comparison.leftName());
        assertEquals("Zeta Z", comparison.rightName());
        assertEquals(List.of("Display", "Resolution", "Chipset", "Memory", "Camera", "Battery", "Price"),
            comparison.rows().stream().map(SpecComparison.Row::label).toList());

        assertEquals(new SpecComparison.Row("Chipset", "Acme A1 (4 nm)", "Zeta Z9"), row(comparison, "Chipset"));
        assertEquals(new SpecComparison.Row("Display", "6.1 inches", "N/A"), row(comparison, "Display"));
        assertEquals(new SpecComparison.Row("Memory", "N/A", "128GB 8GB RAM"), row(comparison, "Memory"));
        assertEquals("48 MP, wide\n12 MP, ultrawide", row(comparison, "Camera").left());
        assertEquals("Li-Ion 3349 mAh", row(comparison, "Battery").left());
        assertEquals("$ 299.99", row(comparison, "Price").right());
    }

    @Test
    void testCompareFallsBackToRawCategories() {
        PhoneRecord raw = new PhoneRecord();
        raw.setName("Acme X1");
        raw.setRawCategories(ACME_X1);

        SpecComparison comparison = SpecificationReport.compare(raw, record("Zeta Z", ZETA_Z));

        assertEquals("Li-Ion 3349 mAh", row(comparison, "Battery").left());
        assertEquals("48 MP, wide\n12 MP, ultrawide", row(comparison, "Camera").left());
        assertEquals("N/A", row(comparison, "Price").left());
    }

    @Test
    void testFormatComparison() {
        String text = SpecificationReport.format(
            SpecificationReport.compare(record("Acme X1", ACME_X1), record("Zeta Z", ZETA_Z)));

        assertTrue(text.startsWith("Comparing: Acme X1 vs Zeta Z\n" + "=".repeat(50) + "\n"));
        assertTrue(text.contains("\nCHIPSET:\n  Acme X1: Acme A1 (4 nm)\n  Zeta Z: Zeta Z9\n"));
    }

    @Test
    void testFormatRecord() {
        PhoneRecord record = record("Acme X1", ACME_X1);
        record.setBrand("Acme");

        String text = SpecificationReport.format(record);

        assertTrue(text.startsWith("Name: Acme X1\nBrand: Acme\n\nSpecifications:\n"));
        assertTrue(text.contains("\n[Display]\n  Type: IPS LCD\n  Size: 6.1 inches\n"));
        assertTrue(text.contains("  Dual: 48 MP, wide\n    12 MP, ultrawide\n"));
    }

    @Test
    void testFormatUsesDetailIdWithoutName() {
        PhoneRecord record = new PhoneRecord();
        record.setDetailId("acme_x1-100");

        assertTrue(SpecificationReport.format(record).startsWith("Name: acme_x1-100\n"));
    }

    private static PhoneRecord record(String name, List<RawCategory> categories) {
        PhoneRecord record = new PhoneRecord();
        record.setName(name);
        record.setRawCategories(categories);
        record.setSpecifications(SpecificationNormalizer.normalize(categories));
        return record;
    }

    private static SpecComparison.Row row(SpecComparison comparison, String label) {
        return comparison.rows().stream()
            .filter(row -> row.label().equals(label))
            .findFirst()
            .orElseThrow();
    }
}
