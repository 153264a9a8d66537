package com.example.fbp.config;

import com.example.fbp.engine.DisplayMapping;
import com.example.fbp.engine.FilterFamily;
import com.example.fbp.engine.RayNormalization;
import com.example.fbp.service.ReconstructionConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code fbp.*} settings from {@code application.properties}; converted into the
 * {@link ReconstructionConfig} used when a caller does not pass its own.
 */
@ConfigurationProperties(prefix = "fbp")
public class FbpProperties {

    private String filterFamily = "hann";
    private Integer outputSize;
    private int maxImageSize = ReconstructionConfig.DEFAULT_MAX_IMAGE_SIZE;
    private boolean windowedSsim = false;
    private int angleCount = 0;
    private RayNormalization rayNormalization = RayNormalization.SUM;
    private DisplayMapping displayMapping = DisplayMapping.LINEAR;
    private boolean includeFilteredSinogram = true;
    private boolean parallel = true;
    private final Demo demo = new Demo();

    public ReconstructionConfig toConfig() {
        return new ReconstructionConfig(FilterFamily.fromName(filterFamily), outputSize, maxImageSize,
                windowedSsim, angleCount, rayNormalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public static class Demo {
        private boolean enabled = false;
        private String phantom = "head-phantom";
        private int size = 128;
        private int angles = 180;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPhantom() {
            return phantom;
        }

        public void setPhantom(String phantom) {
            this.phantom = phantom;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getAngles() {
            return angles;
        }

        public void setAngles(int angles) {
            this.angles = angles;
        }
    }

    public String getFilterFamily() {
        return filterFamily;
    }

    public void setFilterFamily(String filterFamily) {
        this.filterFamily = filterFamily;
    }

    public Integer getOutputSize() {
        return outputSize;
    }

    public void setOutputSize(Integer outputSize) {
        this.outputSize = outputSize;
    }

    public int getMaxImageSize() {
        return maxImageSize;
    }

    public void setMaxImageSize(int maxImageSize) {
        this.maxImageSize = maxImageSize;
    }

    public boolean isWindowedSsim() {
        return windowedSsim;
    }

    public void setWindowedSsim(boolean windowedSsim) {
        this.windowedSsim = windowedSsim;
    }

    public int getAngleCount() {
        return angleCount;
    }

    public void setAngleCount(int angleCount) {
        this.angleCount = angleCount;
    }

    public RayNormalization getRayNormalization() {
        return rayNormalization;
    }

    public void setRayNormalization(RayNormalization rayNormalization) {
        this.rayNormalization = rayNormalization;
    }

    public DisplayMapping getDisplayMapping() {
        return displayMapping;
    }

    public void setDisplayMapping(DisplayMapping displayMapping) {
        this.displayMapping = displayMapping;
    }

    public boolean isIncludeFilteredSinogram() {
        return includeFilteredSinogram;
    }

    public void setIncludeFilteredSinogram(boolean includeFilteredSinogram) {
        this.includeFilteredSinogram = includeFilteredSinogram;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public Demo getDemo() {
        return demo;
    }
}
