package com.aegis.aegis_intel_api.service.risk;

import java.util.Locale;
import java.util.Set;

/**
 * Class vocabularies of the supported detection models.
 */
public enum RiskProfile {

    /** Aerial imagery (DOTA). */
    DOTA(
            Set.of("plane", "helicopter", "ship", "harbor", "large-vehicle", "bridge"),
            Set.of("small-vehicle", "storage-tank", "ground-track-field", "baseball-diamond",
                    "tennis-court", "basketball-court", "soccer-ball-field", "swimming-pool",
                    "roundabout")),

    /** Ground-level military equipment. */
    MILITARY(
            Set.of("tank", "armored_vehicle", "missile_launcher", "artillery", "rocket_launcher",
                    "anti_aircraft_gun", "fighter_jet", "attack_helicopter", "combat_drone",
                    "warship", "submarine"),
            Set.of("military_truck", "patrol_boat", "military_helicopter", "radar_station",
                    "bunker", "recon_drone", "military_personnel", "runway", "helipad")),

    /** Generic COCO-pretrained fallback. */
    COCO(
            Set.of("truck", "bus", "car", "airplane", "helicopter", "knife", "scissors"),
            Set.of("person", "backpack", "handbag", "boat", "train", "bicycle", "motorcycle"));

    private final Set<String> highRisk;
    private final Set<String> mediumRisk;

    RiskProfile(Set<String> highRisk, Set<String> mediumRisk) {
        this.highRisk = highRisk;
        this.mediumRisk = mediumRisk;
    }

    public RiskVocabulary vocabulary() {
        return new RiskVocabulary(name().toLowerCase(Locale.ROOT), highRisk, mediumRisk);
    }

    /**
     * Resolves a configured model type. "auto" and unknown values fall back to COCO,
     * the vocabulary of the stock pretrained weights.
     */
    public static RiskProfile fromModelType(String modelType) {
        if (modelType == null) {
            return COCO;
        }
        return switch (modelType.trim().toLowerCase(Locale.ROOT)) {
            case "dota" -> DOTA;
            case "military" -> MILITARY;
            default -> COCO;
        };
    }
}
