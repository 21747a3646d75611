package com.specharvest.domain.model;

/**
 * Battery section.
 */
public class BatterySpecs {

    private String batteryType;
    private String charging;

    public String getBatteryType() {
        return batteryType;
    }

    public void setBatteryType(String batteryType) {
        this.batteryType = batteryType;
    }

    public String getCharging() {
        return charging;
    }

    public void setCharging(String charging) {
        this.charging = charging;
    }
}
