package com.example.fbp.service;

import com.example.fbp.config.FbpProperties;
import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.RasterImage;
import com.example.fbp.dto.ReconstructionResult;
import com.example.fbp.dto.RunStatistics;
import com.example.fbp.dto.Sinogram;
import com.example.fbp.engine.CancellationToken;
import com.example.fbp.engine.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.GlobalMemory;

import java.time.LocalDateTime;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Entry point for callers. Every call runs in a fresh {@link ReconstructionPipeline} and the result
 * carries wall time, CPU load and memory use of the run.
 */
@Service
public class ReconstructionService {

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionService.class);

    private final ReconstructionConfig defaultConfig;
    private final SystemInfo systemInfo;
    private final CentralProcessor processor;

    private final ReentrantLock cpuLock = new ReentrantLock();
    private long[] prevTicks;

    public ReconstructionService(FbpProperties properties) {
        this.defaultConfig = properties.toConfig();
        this.systemInfo = new SystemInfo();
        this.processor = systemInfo.getHardware().getProcessor();
        this.prevTicks = processor.getSystemCpuLoadTicks();
        logger.info("Reconstruction defaults: filter={}, outputSize={}, maxImageSize={}, windowedSsim={}",
                defaultConfig.filterFamily().id(),
                defaultConfig.outputSize() == null ? "auto" : defaultConfig.outputSize(),
                defaultConfig.maxImageSize(), defaultConfig.windowedSsim());
    }

    public ReconstructionConfig defaultConfig() {
        return defaultConfig;
    }

    /** A session the caller drives directly, e.g. to watch its stage. */
    public ReconstructionPipeline newPipeline(ReconstructionConfig config, ProgressListener listener,
                                              CancellationToken token) {
        return new ReconstructionPipeline(config != null ? config : defaultConfig, listener, token);
    }

    public ReconstructionResult reconstructFromImage(RasterImage image) {
        return reconstructFromImage(image, defaultConfig, ProgressListener.NONE, CancellationToken.create());
    }

    public ReconstructionResult reconstructFromImage(RasterImage image, ReconstructionConfig config,
                                                     ProgressListener listener, CancellationToken token) {
        return timed(newPipeline(config, listener, token), p -> p.reconstructFromImage(image));
    }

    public ReconstructionResult reconstructFromSinogram(RasterImage sinogramRaster, GrayImage groundTruth,
                                                        ReconstructionConfig config, ProgressListener listener,
                                                        CancellationToken token) {
        return timed(newPipeline(config, listener, token), p -> p.reconstructFromSinogram(sinogramRaster, groundTruth));
    }

    public ReconstructionResult reconstructFromSinogram(Sinogram sinogram, GrayImage groundTruth,
                                                        ReconstructionConfig config, ProgressListener listener,
                                                        CancellationToken token) {
        return timed(newPipeline(config, listener, token), p -> p.reconstructFromSinogram(sinogram, groundTruth));
    }

    private ReconstructionResult timed(ReconstructionPipeline pipeline,
                                       Function<ReconstructionPipeline, ReconstructionResult> run) {
        LocalDateTime startTime = LocalDateTime.now();
        long startNanos = System.nanoTime();

        ReconstructionResult result = run.apply(pipeline);

        double cpuPercent = getCpuUsage();
        GlobalMemory memory = systemInfo.getHardware().getMemory();
        double memPercent = (memory.getTotal() - memory.getAvailable()) * 100.0 / memory.getTotal();

        LocalDateTime endTime = LocalDateTime.now();
        double durationSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        logger.info("Reconstruction took {} s (CPU {}%, memory {}%)", String.format("%.3f", durationSeconds),
                String.format("%.1f", cpuPercent), String.format("%.1f", memPercent));

        return result.withStatistics(new RunStatistics(startTime, endTime, durationSeconds, cpuPercent, memPercent));
    }

    private double getCpuUsage() {
        cpuLock.lock();
        try {
            double load = processor.getSystemCpuLoadBetweenTicks(this.prevTicks) * 100.0;
            this.prevTicks = processor.getSystemCpuLoadTicks();
            return load;
        } finally {
            cpuLock.unlock();
        }
    }
}
