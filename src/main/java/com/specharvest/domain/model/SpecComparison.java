package com.specharvest.domain.model;

import java.util.List;

/**
 * Key specifications of two devices side by side.
 *
 * @param leftName  name of the first device
 * @param rightName name of the second device
 * @param rows      one row per compared specification, in display order
 */
public record SpecComparison(String leftName, String rightName, List<Row> rows) {

    /**
     * @param label specification label, e.g. "Chipset"
     * @param left  value for the first device, "N/A" when unknown
     * @param right value for the second device, "N/A" when unknown
     */
    public record Row(String label, String left, String right) {
    }
}
