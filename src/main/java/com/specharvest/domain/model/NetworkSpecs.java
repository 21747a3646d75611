package com.specharvest.domain.model;

/**
 * Network section: technology and supported bands.
 */
public class NetworkSpecs {

    private String technology;
    private String bands2g;
    private String bands3g;
    private String bands4g;
    private String bands5g;
    private String speed;

    public String getTechnology() {
        return technology;
    }

    public void setTechnology(String technology) {
        this.technology = technology;
    }

    public String getBands2g() {
        return bands2g;
    }

    public void setBands2g(String bands2g) {
        this.bands2g = bands2g;
    }

    public String getBands3g() {
        return bands3g;
    }

    public void setBands3g(String bands3g) {
        this.bands3g = bands3g;
    }

    public String getBands4g() {
        return bands4g;
    }

    public void setBands4g(String bands4g) {
        this.bands4g = bands4g;
    }

    public String getBands5g() {
        return bands5g;
    }

    public void setBands5g(String bands5g) {
        this.bands5g = bands5g;
    }

    public String getSpeed() {
        return speed;
    }

    public void setSpeed(String speed) {
        this.speed = speed;
    }
}
