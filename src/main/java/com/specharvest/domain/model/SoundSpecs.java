package com.specharvest.domain.model;

/**
 * Sound section.
 */
public class SoundSpecs {

    private String loudspeaker;
    private String jack35mm;

    public String getLoudspeaker() {
        return loudspeaker;
    }

    public void setLoudspeaker(String loudspeaker) {
        this.loudspeaker = loudspeaker;
    }

    public String getJack35mm() {
        return jack35mm;
    }

    public void setJack35mm(String jack35mm) {
        this.jack35mm = jack35mm;
    }
}
