package com.storeshots.config;

import com.storeshots.service.batch.PromotionMode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storeshots")
public record StoreShotsProperties(
        CatalogProperties catalog,
        GradientProperties gradient,
        FrameProperties frame,
        ValidationProperties validation,
        BatchProperties batch) {

    /**
     * @param location       Spring resource location of the device catalog
     * @param framesDirectory root the catalog's frame asset directories are resolved against
     * @param frameVariant   preferred bezel variant; blank means each device's default
     * @param defaultDevice  device used when neither file name nor dimensions match; may be blank
     */
    public record CatalogProperties(
            String location,
            String framesDirectory,
            String frameVariant,
            String defaultDevice) {
    }

    public record GradientProperties(
            String centerColor,
            String edgeColor,
            ShadowProperties shadow,
            CornerProperties corners) {
    }

    public record ShadowProperties(
            double blurRadius,
            double opacity,
            int offsetY) {
    }

    public record CornerProperties(
            boolean enabled,
            int baseRadius,
            int referenceWidth,
            int minimumRadius) {
    }

    public record FrameProperties(
            String backgroundColor,
            String screenFillColor,
            int screenFillPadding) {
    }

    public record ValidationProperties(
            long minOutputBytes,
            long maxOutputBytes,
            double blankDarkThreshold,
            double blankLightThreshold) {
    }

    public record BatchProperties(
            List<String> extensions,
            List<String> excludedDirectories,
            int workers,
            Duration timeout,
            PromotionMode mode,
            String defaultOutputName,
            CompletenessProperties completeness) {
    }

    /**
     * @param expected minimum number of assets each locale must produce per device id or name;
     *                 empty disables the check
     * @param enforce  treat an incomplete locale as a failure instead of a warning
     */
    public record CompletenessProperties(
            Map<String, Integer> expected,
            boolean enforce) {
    }
}
