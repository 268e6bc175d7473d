package com.driftsentinel.core.detection;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link DistributionDistance} instances by name.
 *
 * <p>
 * This is the single point of extension when adding a new drift metric:
 * register the name here and create the corresponding implementation.
 * </p>
 *
 * @since 1.0.0
 */
public final class DistanceFactory {

    public static final String PSI = "psi";
    public static final String CHI_SQUARE = "chi-square";
    public static final String MAX_ABS = "max-abs";

    private static final List<String> SUPPORTED = List.of(PSI, CHI_SQUARE, MAX_ABS);

    private DistanceFactory() {
        // utility class
    }

    /**
     * Create a distance for the given name (case-insensitive).
     *
     * @param name metric name; must not be {@code null}
     * @return a new {@link DistributionDistance}
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DistributionDistance create(String name) {
        Objects.requireNonNull(name, "Distance metric name must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case PSI -> new PopulationStabilityIndex();
            case CHI_SQUARE -> new ChiSquareDistance();
            case MAX_ABS -> new MaxAbsoluteDistance();
            default -> throw new IllegalArgumentException(
                    "Unknown distance metric: '" + name + "'. Supported: " + String.join(", ", SUPPORTED));
        };
    }

    public static boolean isSupported(String name) {
        return name != null && SUPPORTED.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return unmodifiable list of supported metric names
     */
    public static List<String> supportedNames() {
        return SUPPORTED;
    }
}
