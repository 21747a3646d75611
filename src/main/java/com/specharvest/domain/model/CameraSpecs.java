package com.specharvest.domain.model;

/**
 * Camera section, shared by the main and selfie cameras.
 * {@code modules} holds the value of whichever module-count row the page
 * carries (single, dual, triple, quad or penta).
 */
public class CameraSpecs {

    private String modules;
    private String features;
    private String video;

    public String getModules() {
        return modules;
    }

    public void setModules(String modules) {
        this.modules = modules;
    }

    public String getFeatures() {
        return features;
    }

    public void setFeatures(String features) {
        this.features = features;
    }

    public String getVideo() {
        return video;
    }

    public void setVideo(String video) {
        this.video = video;
    }
}
