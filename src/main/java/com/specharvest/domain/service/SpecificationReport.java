package com.specharvest.domain.service;

import com.specharvest.domain.model.NormalizedSpec;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.model.SpecComparison;
import com.specharvest.domain.model.SpecPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Human-readable views of harvested records: spec lookup by key, a plain text
 * listing of all categories and a side-by-side comparison of two devices.
 *
 * Comparison rows read the normalized section first and fall back to the
 * first raw pair of the matching category whose key contains the row's term.
 */
public final class SpecificationReport {

    static final String NOT_AVAILABLE = "N/A";
    private static final int RULE_WIDTH = 50;

    // a blank raw key matches the first pair of the category, the camera module line
    private static final List<ComparedSpec> COMPARED_SPECS = List.of(
        new ComparedSpec("Display", "display", "size",
            spec -> spec.getDisplay() == null ? null : spec.getDisplay().getSize()),
        new ComparedSpec("Resolution", "display", "resolution",
            spec -> spec.getDisplay() == null ? null : spec.getDisplay().getResolution()),
        new ComparedSpec("Chipset", "platform", "chipset",
            spec -> spec.getPlatform() == null ? null : spec.getPlatform().getChipset()),
        new ComparedSpec("Memory", "memory", "internal",
            spec -> spec.getMemory() == null ? null : spec.getMemory().getInternal()),
        new ComparedSpec("Camera", "main camera", "",
            spec -> spec.getMainCamera() == null ? null : spec.getMainCamera().getModules()),
        new ComparedSpec("Battery", "battery", "type",
            spec -> spec.getBattery() == null ? null : spec.getBattery().getBatteryType()),
        new ComparedSpec("Price", "misc", "price",
            spec -> spec.getMisc() == null ? null : spec.getMisc().getPrice())
    );

    private SpecificationReport() {
    }

    /**
     * Returns the value of the first pair, in page order, whose key contains
     * {@code key} ignoring case.
     */
    public static Optional<String> findSpec(List<RawCategory> categories, String key) {
        return findSpec(categories, null, key);
    }

    /**
     * Same as {@link #findSpec(List, String)} but only searches categories
     * titled {@code categoryTitle} (ignoring case), or all of them when it is null.
     */
    public static Optional<String> findSpec(List<RawCategory> categories, String categoryTitle, String key) {
        if (categories == null || key == null) {
            return Optional.empty();
        }
        String searchKey = key.toLowerCase(Locale.ROOT);
        for (RawCategory category : categories) {
            if (categoryTitle != null && !categoryTitle.equalsIgnoreCase(category.title())) {
                continue;
            }
            for (SpecPair pair : category.pairs()) {
                if (pair.key() != null && pair.key().toLowerCase(Locale.ROOT).contains(searchKey)) {
                    return Optional.ofNullable(pair.value());
                }
            }
        }
        return Optional.empty();
    }

    public static SpecComparison compare(PhoneRecord left, PhoneRecord right) {
        List<SpecComparison.Row> rows = new ArrayList<>(COMPARED_SPECS.size());
        for (ComparedSpec compared : COMPARED_SPECS) {
            rows.add(new SpecComparison.Row(compared.label(), compared.valueOf(left), compared.valueOf(right)));
        }
        return new SpecComparison(displayName(left), displayName(right), rows);
    }

    public static String format(PhoneRecord record) {
        StringBuilder out = new StringBuilder();
        out.append("Name: ").append(displayName(record)).append('\n');
        if (record.getBrand() != null) {
            out.append("Brand: ").append(record.getBrand()).append('\n');
        }
        out.append("\nSpecifications:\n");
        if (record.getRawCategories() != null) {
            for (RawCategory category : record.getRawCategories()) {
                out.append("\n[").append(category.title()).append("]\n");
                for (SpecPair pair : category.pairs()) {
                    // continuation lines are indented under their key
                    String value = pair.value() == null ? "" : pair.value().replace("\n", "\n    ");
                    out.append("  ").append(pair.key()).append(": ").append(value).append('\n');
                }
            }
        }
        return out.toString();
    }

    public static String format(SpecComparison comparison) {
        StringBuilder out = new StringBuilder();
        out.append("Comparing: ").append(comparison.leftName()).append(" vs ").append(comparison.rightName()).append('\n');
        out.append("=".repeat(RULE_WIDTH)).append('\n');
        for (SpecComparison.Row row : comparison.rows()) {
            out.append('\n').append(row.label().toUpperCase(Locale.ROOT)).append(":\n");
            out.append("  ").append(comparison.leftName()).append(": ").append(row.left()).append('\n');
            out.append("  ").append(comparison.rightName()).append(": ").append(row.right()).append('\n');
        }
        return out.toString();
    }

    private static String displayName(PhoneRecord record) {
        if (record.getName() != null) {
            return record.getName();
        }
        return record.getDetailId() != null ? record.getDetailId() : "Unknown";
    }

    private record ComparedSpec(String label,
                                String category,
                                String rawKey,
                                Function<NormalizedSpec, String> normalized) {

        String valueOf(PhoneRecord record) {
            String value = record.getSpecifications() == null ? null : normalized.apply(record.getSpecifications());
            if (value != null) {
                return value;
            }
            return findSpec(record.getRawCategories(), category, rawKey).orElse(NOT_AVAILABLE);
        }
    }
}
