package com.specharvest.domain.model;

/**
 * Launch section.
 */
public class LaunchSpecs {

    private String announced;
    private String status;

    public String getAnnounced() {
        return announced;
    }

    public void setAnnounced(String announced) {
        this.announced = announced;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
