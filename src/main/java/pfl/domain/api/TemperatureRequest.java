package pfl.domain.api;

import pfl.common.EHeater;

import java.util.Locale;

/**
 * Body of {@code POST /api/printers/{id}/temperature}
 * @since 22/01/2026
 */
public class TemperatureRequest {
    static final double MAX_TARGET = 350.0;

    private String heater;
    private Double target;

    public TemperatureRequest() {
    }

    public TemperatureRequest(String heater, Double target) {
        this.heater = heater;
        this.target = target;
    }

    public String getHeater() {
        return heater;
    }

    public Double getTarget() {
        return target;
    }

    /**
     * @throws IllegalArgumentException naming the first invalid field
     */
    public EHeater validate() {
        if (heater == null || heater.isBlank()) {
            throw new IllegalArgumentException("Heater is required (BED or NOZZLE)");
        }
        EHeater parsed;
        try {
            parsed = EHeater.valueOf(heater.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown heater '" + heater + "', expected BED or NOZZLE");
        }
        if (target == null || target < 0 || target > MAX_TARGET) {
            throw new IllegalArgumentException("Target must be between 0 and " + (int) MAX_TARGET);
        }
        return parsed;
    }
}
