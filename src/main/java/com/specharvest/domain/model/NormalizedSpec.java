package com.specharvest.domain.model;

/**
 * Fixed-schema view of a device's specification categories.
 * A section is null when its category was absent from the source page.
 */
public class NormalizedSpec {

    private NetworkSpecs network;
    private LaunchSpecs launch;
    private BodySpecs body;
    private DisplaySpecs display;
    private PlatformSpecs platform;
    private MemorySpecs memory;
    private CameraSpecs mainCamera;
    private CameraSpecs selfieCamera;
    private SoundSpecs sound;
    private CommsSpecs comms;
    private FeaturesSpecs features;
    private BatterySpecs battery;
    private MiscSpecs misc;

    public NetworkSpecs getNetwork() {
        return network;
    }

    public void setNetwork(NetworkSpecs network) {
        this.network = network;
    }

    public LaunchSpecs getLaunch() {
        return launch;
    }

    public void setLaunch(LaunchSpecs launch) {
        this.launch = launch;
    }

    public BodySpecs getBody() {
        return body;
    }

    public void setBody(BodySpecs body) {
        this.body = body;
    }

    public DisplaySpecs getDisplay() {
        return display;
    }

    public void setDisplay(DisplaySpecs display) {
        this.display = display;
    }

    public PlatformSpecs getPlatform() {
        return platform;
    }

    public void setPlatform(PlatformSpecs platform) {
        this.platform = platform;
    }

    public MemorySpecs getMemory() {
        return memory;
    }

    public void setMemory(MemorySpecs memory) {
        this.memory = memory;
    }

    public CameraSpecs getMainCamera() {
        return mainCamera;
    }

    public void setMainCamera(CameraSpecs mainCamera) {
        this.mainCamera = mainCamera;
    }

    public CameraSpecs getSelfieCamera() {
        return selfieCamera;
    }

    public void setSelfieCamera(CameraSpecs selfieCamera) {
        this.selfieCamera = selfieCamera;
    }

    public SoundSpecs getSound() {
        return sound;
    }

    public void setSound(SoundSpecs sound) {
        this.sound = sound;
    }

    public CommsSpecs getComms() {
        return comms;
    }

    public void setComms(CommsSpecs comms) {
        this.comms = comms;
    }

    public FeaturesSpecs getFeatures() {
        return features;
    }

    public void setFeatures(FeaturesSpecs features) {
        this.features = features;
    }

    public BatterySpecs getBattery() {
        return battery;
    }

    public void setBattery(BatterySpecs battery) {
        this.battery = battery;
    }

    public MiscSpecs getMisc() {
        return misc;
    }

    public void setMisc(MiscSpecs misc) {
        this.misc = misc;
    }
}
