package heatstress.config;

import lombok.Builder;
import lombok.With;

/**
 * Constantes físicas inmutables del modelo de globo negro.
 * <p>
 * Se inyectan en el solver en lugar de vivir como literales sueltos, de modo que
 * se pueda evaluar el balance con otro globo (otro diámetro, otra pintura) sin tocar código.
 *
 * @param globeDiameter          Diámetro del globo D en metros.
 * @param airThermalConductivity Conductividad térmica del aire k_air (W/m·K).
 * @param kinematicViscosity     Viscosidad cinemática del aire ν (m²/s).
 * @param solarAbsorptivity      Absortividad solar efectiva α_sp, referida a la superficie total de la esfera.
 *                               El valor estándar es 0.95 (pintura negra mate) por 1/4, la relación
 *                               entre la sección proyectada y la superficie de la esfera.
 * @param longwaveEmissivity     Emisividad de onda larga del globo ε.
 * @param atmosphericEmissivity  Emisividad de la atmósfera ε_a (radiación descendente de onda larga).
 * @param stefanBoltzmann        Constante de Stefan–Boltzmann σ (W/m²·K⁴).
 */
@Builder
@With
public record GlobeConstants(
        double globeDiameter,
        double airThermalConductivity,
        double kinematicViscosity,
        double solarAbsorptivity,
        double longwaveEmissivity,
        double atmosphericEmissivity,
        double stefanBoltzmann
) {

    public static final double KELVIN_OFFSET = 273.15;

    public GlobeConstants {
        if (globeDiameter <= 0) {
            throw new IllegalArgumentException("El diámetro del globo debe ser positivo.");
        }
        if (kinematicViscosity <= 0) {
            throw new IllegalArgumentException("La viscosidad cinemática debe ser positiva.");
        }
        if (airThermalConductivity <= 0) {
            throw new IllegalArgumentException("La conductividad térmica del aire debe ser positiva.");
        }
        if (longwaveEmissivity <= 0 || longwaveEmissivity > 1) {
            throw new IllegalArgumentException("La emisividad del globo debe estar en (0, 1]: " + longwaveEmissivity);
        }
        if (stefanBoltzmann <= 0) {
            throw new IllegalArgumentException("La constante de Stefan-Boltzmann debe ser positiva.");
        }
        if (solarAbsorptivity < 0 || atmosphericEmissivity < 0) {
            throw new IllegalArgumentException("La absortividad solar y la emisividad atmosférica no pueden ser negativas.");
        }
    }

    /**
     * Globo estándar de 5 cm.
     */
    public static GlobeConstants standard() {
        return GlobeConstants.builder()
                .globeDiameter(0.05)
                .airThermalConductivity(0.025)
                .kinematicViscosity(1.5e-5)
                .solarAbsorptivity(0.95 * 0.25)
                .longwaveEmissivity(0.95)
                .atmosphericEmissivity(0.85)
                .stefanBoltzmann(5.67e-8)
                .build();
    }
}
