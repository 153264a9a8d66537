package com.example.fbp;

import com.example.fbp.config.FbpProperties;
import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.RasterImage;
import com.example.fbp.dto.ReconstructionResult;
import com.example.fbp.engine.CancellationToken;
import com.example.fbp.engine.PhantomGenerator;
import com.example.fbp.engine.PhantomKind;
import com.example.fbp.service.ReconstructionConfig;
import com.example.fbp.service.ReconstructionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reconstructs a synthetic phantom at start-up and logs the quality metrics. Enabled with
 * {@code fbp.demo.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "fbp.demo", name = "enabled", havingValue = "true")
public class PhantomDemoRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(PhantomDemoRunner.class);

    private final ReconstructionService reconstructionService;
    private final FbpProperties properties;

    public PhantomDemoRunner(ReconstructionService reconstructionService, FbpProperties properties) {
        this.reconstructionService = reconstructionService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        FbpProperties.Demo demo = properties.getDemo();
        PhantomKind kind = PhantomKind.fromName(demo.getPhantom());
        logger.info("[DEMO] Generating {} phantom {}x{}, {} projections", kind, demo.getSize(), demo.getSize(),
                demo.getAngles());

        GrayImage phantom = PhantomGenerator.generate(kind, demo.getSize());
        ReconstructionConfig config = reconstructionService.defaultConfig().withAngleCount(demo.getAngles());

        ReconstructionResult result = reconstructionService.reconstructFromImage(RasterImage.fromGray(phantom),
                config, (percent, message) -> logger.info("[DEMO] {}% {}", percent, message),
                CancellationToken.create());

        result.qualityMetrics().ifPresent(m -> logger.info("[DEMO] {} / {}: MSE={} PSNR={} dB SSIM={}",
                kind, result.filterUsed().id(), String.format("%.2f", m.mse()), String.format("%.2f", m.psnr()),
                String.format("%.4f", m.ssim())));
    }
}
