package com.specharvest.domain.model;

/**
 * Memory section.
 */
public class MemorySpecs {

    private String cardSlot;
    private String internal;

    public String getCardSlot() {
        return cardSlot;
    }

    public void setCardSlot(String cardSlot) {
        this.cardSlot = cardSlot;
    }

    public String getInternal() {
        return internal;
    }

    public void setInternal(String internal) {
        this.internal = internal;
    }
}
