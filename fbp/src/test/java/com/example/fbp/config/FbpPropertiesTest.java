package com.example.fbp.config;

import com.example.fbp.engine.DisplayMapping;
import com.example.fbp.engine.FilterFamily;
import com.example.fbp.exception.InvalidInputException;
import com.example.fbp.service.ReconstructionConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FbpPropertiesTest {

    @Test
    void testDefaultsMatchConfigDefaults() {
        assertEquals(ReconstructionConfig.defaults(), new FbpProperties().toConfig());
    }

    @Test
    void testToConfig() {
        FbpProperties properties = new FbpProperties();
        properties.setFilterFamily("Shepp_Logan");
        properties.setOutputSize(96);
        properties.setAngleCount(120);
        properties.setDisplayMapping(DisplayMapping.PERCENTILE_GAMMA);
        properties.setParallel(false);

        ReconstructionConfig config = properties.toConfig();
        assertEquals(FilterFamily.SHEPP_LOGAN, config.filterFamily());
        assertEquals(96, config.outputSize());
        assertEquals(120, config.angleCount());
        assertEquals(DisplayMapping.PERCENTILE_GAMMA, config.displayMapping());
        assertFalse(config.parallel());
    }

    @Test
    void testUnknownFilterIsRejected() {
        FbpProperties properties = new FbpProperties();
        properties.setFilterFamily("blackman");
        assertThrows(InvalidInputException.class, properties::toConfig);

        properties.setFilterFamily("hann");
        properties.setMaxImageSize(0);
        assertThrows(InvalidInputException.class, properties::toConfig);
    }
}
