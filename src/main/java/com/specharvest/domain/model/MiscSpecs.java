package com.specharvest.domain.model;

/**
 * Miscellaneous section: colors, model numbers, SAR values and price.
 */
public class MiscSpecs {

    private String colors;
    private String models;
    private String sar;
    private String sarEu;
    private String price;

    public String getColors() {
        return colors;
    }

    public void setColors(String colors) {
        this.colors = colors;
    }

    public String getModels() {
        return models;
    }

    public void setModels(String models) {
        this.models = models;
    }

    public String getSar() {
        return sar;
    }

    public void setSar(String sar) {
        this.sar = sar;
    }

    public String getSarEu() {
        return sarEu;
    }

    public void setSarEu(String sarEu) {
        this.sarEu = sarEu;
    }

    public String getPrice() {
        return price;
    }

    public void setPrice(String price) {
        this.price = price;
    }
}
