package pfl.domain.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EHeater;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TemperatureRequest
 * @since 22/01/2026
 */
class TemperatureRequestTest {

    @Test
    @DisplayName("Should accept heater names in any case")
    void shouldParseHeater() {
        assertThat(new TemperatureRequest("bed", 60.0).validate()).isEqualTo(EHeater.BED);
        assertThat(new TemperatureRequest(" Nozzle ", 215.0).validate()).isEqualTo(EHeater.NOZZLE);
    }

    @Test
    @DisplayName("Should accept both ends of the target range")
    void shouldAcceptRangeBounds() {
        assertThat(new TemperatureRequest("NOZZLE", 0.0).validate()).isEqualTo(EHeater.NOZZLE);
        assertThat(new TemperatureRequest("NOZZLE", 350.0).validate()).isEqualTo(EHeater.NOZZLE);
    }

    @Test
    @DisplayName("Should reject a missing or unknown heater")
    void shouldRejectHeater() {
        assertThatThrownBy(() -> new TemperatureRequest(null, 60.0).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Heater is required (BED or NOZZLE)");
        assertThatThrownBy(() -> new TemperatureRequest("chamber", 40.0).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown heater 'chamber', expected BED or NOZZLE");
    }

    @Test
    @DisplayName("Should reject a target outside 0..350")
    void shouldRejectTarget() {
        assertThatThrownBy(() -> new TemperatureRequest("BED", 351.0).validate())
                .hasMessage("Target must be between 0 and 350");
        assertThatThrownBy(() -> new TemperatureRequest("BED", -1.0).validate())
                .hasMessage("Target must be between 0 and 350");
        assertThatThrownBy(() -> new TemperatureRequest("BED", null).validate())
                .hasMessage("Target must be between 0 and 350");
    }
}
