package heatstress.physics.model;

import heatstress.config.GlobeConstants;

/**
 * Balance radiativo-convectivo estacionario de un globo negro para UNA celda.
 * <p>
 * Los términos que no dependen de Tg (Reynolds, h_c y la energía absorbida) se calculan
 * una sola vez en la construcción; después {@link #value(double)} y {@link #derivative(double)}
 * son funciones puras de Tg, evaluables para cualquier real.
 * <pre>
 *   f(Tg)  = ε·σ·Tg⁴ + h_c·(Tg − TaK) − left
 *   f'(Tg) = 4·ε·σ·Tg³ + h_c
 * </pre>
 * Stateless y Thread-Safe.
 */
public final class EnergyBalanceEquation {

    private final double airTemperatureKelvin;
    private final double reynoldsNumber;
    private final double convectiveCoefficient;
    private final double absorbedFlux;
    private final double emissivitySigma;

    private EnergyBalanceEquation(double airTemperatureKelvin, double reynoldsNumber, double convectiveCoefficient,
                                  double absorbedFlux, double emissivitySigma) {
        this.airTemperatureKelvin = airTemperatureKelvin;
        this.reynoldsNumber = reynoldsNumber;
        this.convectiveCoefficient = convectiveCoefficient;
        this.absorbedFlux = absorbedFlux;
        this.emissivitySigma = emissivitySigma;
    }

    /**
     * @param airTemperatureKelvin Temperatura del aire TaK (K).
     * @param shortwave            Radiación de onda corta SW (W/m²). No se rechazan valores negativos.
     * @param windSpeed            Velocidad del viento (m/s). Los negativos se recortan a 0.
     * @param constants            Constantes del globo.
     */
    public static EnergyBalanceEquation forCell(double airTemperatureKelvin, double shortwave, double windSpeed,
                                                GlobeConstants constants) {
        final double ws = Math.max(0.0, windSpeed);
        final double d = constants.globeDiameter();
        final double sigma = constants.stefanBoltzmann();
        final double eps = constants.longwaveEmissivity();

        double re = ws * d / constants.kinematicViscosity();
        double hc = 0.0014 * Math.pow(re, 0.6) * (constants.airThermalConductivity() / d);

        // Solar absorbida + onda larga atmosférica descendente absorbida
        double taK4 = Math.pow(airTemperatureKelvin, 4);
        double left = constants.solarAbsorptivity() * shortwave
                + eps * constants.atmosphericEmissivity() * sigma * taK4;

        return new EnergyBalanceEquation(airTemperatureKelvin, re, hc, left, eps * sigma);
    }

    public double value(double globeTemperatureKelvin) {
        double tg = globeTemperatureKelvin;
        return emissivitySigma * tg * tg * tg * tg
                + convectiveCoefficient * (tg - airTemperatureKelvin)
                - absorbedFlux;
    }

    public double derivative(double globeTemperatureKelvin) {
        double tg = globeTemperatureKelvin;
        return 4.0 * emissivitySigma * tg * tg * tg + convectiveCoefficient;
    }

    /**
     * Raíz analítica cuando no hay convección (h_c = 0): ε·σ·Tg⁴ = left.
     * Devuelve NaN si la energía absorbida es negativa o la emisividad es nula.
     */
    public double radiativeEquilibriumKelvin() {
        if (emissivitySigma <= 0 || absorbedFlux < 0) return Double.NaN;
        return Math.pow(absorbedFlux / emissivitySigma, 0.25);
    }

    public double getAirTemperatureKelvin() {
        return airTemperatureKelvin;
    }

    public double getReynoldsNumber() {
        return reynoldsNumber;
    }

    public double getConvectiveCoefficient() {
        return convectiveCoefficient;
    }

    public double getAbsorbedFlux() {
        return absorbedFlux;
    }
}
