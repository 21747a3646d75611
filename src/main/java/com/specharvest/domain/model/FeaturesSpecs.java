package com.specharvest.domain.model;

/**
 * Features section.
 */
public class FeaturesSpecs {

    private String sensors;

    public String getSensors() {
        return sensors;
    }

    public void setSensors(String sensors) {
        this.sensors = sensors;
    }
}
