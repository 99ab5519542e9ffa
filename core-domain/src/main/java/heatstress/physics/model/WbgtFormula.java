package heatstress.physics.model;

/**
 * Combinación algebraica fija del índice WBGT.
 * <ul>
 *   <li>Exterior: WBGT = 0.7·Tw + 0.2·Tg + 0.1·Ta</li>
 *   <li>Interior (sin carga solar): WBGT = 0.7·Tw + 0.3·Tg</li>
 * </ul>
 */
public final class WbgtFormula {

    public enum ExposureMode {
        OUTDOOR,
        INDOOR
    }

    private WbgtFormula() {}

    /**
     * Todas las temperaturas en °C. Cualquier operando ausente (NaN) produce NaN.
     */
    public static double combine(double wetBulb, double globe, double air, ExposureMode mode) {
        if (Double.isNaN(wetBulb) || Double.isNaN(globe)) return Double.NaN;

        if (mode == ExposureMode.INDOOR) {
            return 0.7 * wetBulb + 0.3 * globe;
        }
        if (Double.isNaN(air)) return Double.NaN;
        return 0.7 * wetBulb + 0.2 * globe + 0.1 * air;
    }
}
