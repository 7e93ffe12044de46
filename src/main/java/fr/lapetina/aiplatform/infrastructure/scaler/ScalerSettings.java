package fr.lapetina.aiplatform.infrastructure.scaler;

import java.time.Duration;
import java.util.List;

/**
 * @param rpsCeiling requests per second above which a feature scales up regardless of CPU or queue
 */
public record ScalerSettings(Duration loopInterval, double rpsCeiling, List<ScaleConfig> configs) {

    public static final double DEFAULT_RPS_CEILING = 100.0;

    public ScalerSettings {
        if (loopInterval == null || loopInterval.isZero() || loopInterval.isNegative()) {
            throw new IllegalArgumentException("Scale loop interval must be positive");
        }
        configs = configs == null ? List.of() : List.copyOf(configs);
    }

    public static ScalerSettings defaults() {
        return new ScalerSettings(Duration.ofSeconds(30), DEFAULT_RPS_CEILING, defaultConfigs());
    }

    public static List<ScaleConfig> defaultConfigs() {
        return List.of(
                ScaleConfig.builder("text_to_image")
                        .instances(0, 5)
                        .targetQueueSize(50)
                        .idleTimeout(Duration.ofMinutes(15))
                        .build(),
                ScaleConfig.builder("image_editing")
                        .instances(0, 3)
                        .targetQueueSize(30)
                        .idleTimeout(Duration.ofMinutes(10))
                        .build(),
                ScaleConfig.builder("image_stylization")
                        .instances(0, 2)
                        .targetQueueSize(20)
                        .idleTimeout(Duration.ofMinutes(10))
                        .build()
        );
    }
}
