package com.specharvest.domain.service;

import com.specharvest.domain.model.BatterySpecs;
import com.specharvest.domain.model.BodySpecs;
import com.specharvest.domain.model.CameraSpecs;
import com.specharvest.domain.model.CommsSpecs;
import com.specharvest.domain.model.DisplaySpecs;
import com.specharvest.domain.model.FeaturesSpecs;
import com.specharvest.domain.model.LaunchSpecs;
import com.specharvest.domain.model.MemorySpecs;
import com.specharvest.domain.model.MiscSpecs;
import com.specharvest.domain.model.NetworkSpecs;
import com.specharvest.domain.model.NormalizedSpec;
import com.specharvest.domain.model.PlatformSpecs;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.model.SoundSpecs;
import com.specharvest.domain.model.SpecPair;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw specification categories onto the fixed normalized schema.
 *
 * Rules:
 * 1. Category titles and keys are matched case-insensitively
 * 2. A category that is absent leaves its section null
 * 3. A key that is absent leaves its field null
 * 4. When a key repeats within a category the last value wins
 * 5. Camera modules take the first of single, dual, triple, quad, penta
 */
public final class SpecificationNormalizer {

    private static final List<String> CAMERA_MODULE_KEYS = List.of("single", "dual", "triple", "quad", "penta");

    private SpecificationNormalizer() {
    }

    public static NormalizedSpec normalize(List<RawCategory> categories) {
        Map<String, Map<String, String>> byTitle = index(categories);
        NormalizedSpec spec = new NormalizedSpec();

        Map<String, String> values = byTitle.get("network");
        if (values != null) {
            NetworkSpecs network = new NetworkSpecs();
            network.setTechnology(values.get("technology"));
            network.setBands2g(values.get("2g bands"));
            network.setBands3g(values.get("3g bands"));
            network.setBands4g(values.get("4g bands"));
            network.setBands5g(values.get("5g bands"));
            network.setSpeed(values.get("speed"));
            spec.setNetwork(network);
        }

        values = byTitle.get("launch");
        if (values != null) {
            LaunchSpecs launch = new LaunchSpecs();
            launch.setAnnounced(values.get("announced"));
            launch.setStatus(values.get("status"));
            spec.setLaunch(launch);
        }

        values = byTitle.get("body");
        if (values != null) {
            BodySpecs body = new BodySpecs();
            body.setDimensions(values.get("dimensions"));
            body.setWeight(values.get("weight"));
            body.setBuild(values.get("build"));
            body.setSim(values.get("sim"));
            spec.setBody(body);
        }

        values = byTitle.get("display");
        if (values != null) {
            DisplaySpecs display = new DisplaySpecs();
            display.setDisplayType(values.get("type"));
            display.setSize(values.get("size"));
            display.setResolution(values.get("resolution"));
            display.setProtection(values.get("protection"));
            spec.setDisplay(display);
        }

        values = byTitle.get("platform");
        if (values != null) {
            PlatformSpecs platform = new PlatformSpecs();
            platform.setOs(values.get("os"));
            platform.setChipset(values.get("chipset"));
            platform.setCpu(values.get("cpu"));
            platform.setGpu(values.get("gpu"));
            spec.setPlatform(platform);
        }

        values = byTitle.get("memory");
        if (values != null) {
            MemorySpecs memory = new MemorySpecs();
            memory.setCardSlot(values.get("card slot"));
            memory.setInternal(values.get("internal"));
            spec.setMemory(memory);
        }

        spec.setMainCamera(camera(byTitle.get("main camera")));
        spec.setSelfieCamera(camera(byTitle.get("selfie camera")));

        values = byTitle.get("sound");
        if (values != null) {
            SoundSpecs sound = new SoundSpecs();
            sound.setLoudspeaker(values.get("loudspeaker"));
            sound.setJack35mm(values.get("3.5mm jack"));
            spec.setSound(sound);
        }

        values = byTitle.get("comms");
        if (values != null) {
            CommsSpecs comms = new CommsSpecs();
            comms.setWlan(values.get("wlan"));
            comms.setBluetooth(values.get("bluetooth"));
            comms.setPositioning(values.get("positioning"));
            comms.setNfc(values.get("nfc"));
            comms.setRadio(values.get("radio"));
            comms.setUsb(values.get("usb"));
            spec.setComms(comms);
        }

        values = byTitle.get("features");
        if (values != null) {
            FeaturesSpecs features = new FeaturesSpecs();
            features.setSensors(values.get("sensors"));
            spec.setFeatures(features);
        }

        values = byTitle.get("battery");
        if (values != null) {
            BatterySpecs battery = new BatterySpecs();
            battery.setBatteryType(values.get("type"));
            battery.setCharging(values.get("charging"));
            spec.setBattery(battery);
        }

        values = byTitle.get("misc");
        if (values != null) {
            MiscSpecs misc = new MiscSpecs();
            misc.setColors(values.get("colors"));
            misc.setModels(values.get("models"));
            misc.setSar(values.get("sar"));
            misc.setSarEu(values.get("sar eu"));
            misc.setPrice(values.get("price"));
            spec.setMisc(misc);
        }

        return spec;
    }

    private static CameraSpecs camera(Map<String, String> values) {
        if (values == null) {
            return null;
        }
        CameraSpecs camera = new CameraSpecs();
        for (String key : CAMERA_MODULE_KEYS) {
            if (values.containsKey(key)) {
                camera.setModules(values.get(key));
                break;
            }
        }
        camera.setFeatures(values.get("features"));
        camera.setVideo(values.get("video"));
        return camera;
    }

    private static Map<String, Map<String, String>> index(List<RawCategory> categories) {
        Map<String, Map<String, String>> byTitle = new HashMap<>();
        if (categories == null) {
            return byTitle;
        }
        for (RawCategory category : categories) {
            if (category.title() == null) {
                continue;
            }
            Map<String, String> values = byTitle.computeIfAbsent(lowerCase(category.title()), t -> new LinkedHashMap<>());
            for (SpecPair pair : category.pairs()) {
                if (pair.key() != null) {
                    values.put(lowerCase(pair.key()), pair.value());
                }
            }
        }
        return byTitle;
    }

    private static String lowerCase(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
