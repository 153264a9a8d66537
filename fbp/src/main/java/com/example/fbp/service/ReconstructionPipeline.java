package com.example.fbp.service;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.QualityMetrics;
import com.example.fbp.dto.RasterImage;
import com.example.fbp.dto.ReconstructionResult;
import com.example.fbp.dto.Sinogram;
import com.example.fbp.engine.BackProjector;
import com.example.fbp.engine.CancellationToken;
import com.example.fbp.engine.FilterBank;
import com.example.fbp.engine.ForwardProjector;
import com.example.fbp.engine.ImageQuantizer;
import com.example.fbp.engine.MetricsEvaluator;
import com.example.fbp.engine.Preprocessor;
import com.example.fbp.engine.ProgressListener;
import com.example.fbp.engine.ProgressTracker;
import com.example.fbp.exception.InvalidInputException;
import com.example.fbp.exception.ReconstructionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One reconstruction session. Runs the stages
 * {@code IDLE -> PREPROCESSING -> FILTERING -> BACK_PROJECTING -> [EVALUATING] -> DONE} exactly
 * once; any failure leaves the session in {@code FAILED} (or {@code CANCELLED}) and no result is
 * returned. Evaluation only happens when a ground-truth image is available.
 *
 * <p>Instances are not shared: the caller creates one per run and owns every buffer it produces.
 */
public class ReconstructionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ReconstructionPipeline.class);

    private static final int FILTER_PERCENT = 30;
    private static final int BACKPROJECTION_START = 50;
    private static final int BACKPROJECTION_END = 90;
    private static final int EVALUATION_PERCENT = 95;

    private final ReconstructionConfig config;
    private final ProgressTracker tracker;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile PipelineStage stage = PipelineStage.IDLE;

    /** Output of the preprocessing stage handed to the filter. */
    private record Prepared(Sinogram sinogram, int outputSize, GrayImage groundTruthLevels) {
    }

    public ReconstructionPipeline(ReconstructionConfig config, ProgressListener listener, CancellationToken token) {
        this.config = config != null ? config : ReconstructionConfig.defaults();
        this.tracker = new ProgressTracker(listener, token);
    }

    public PipelineStage stage() {
        return stage;
    }

    /**
     * Preprocesses a color image, projects it into a sinogram and reconstructs it. The preprocessed
     * image is the ground truth for the metrics.
     */
    public ReconstructionResult reconstructFromImage(RasterImage image) {
        begin();
        try {
            InvalidInputException.require(image != null, "Input image is null");
            logger.info("Starting reconstruction from a {}x{} image. Filter={}, AngleCount={}, MaxSize={}",
                    image.width(), image.height(), config.filterFamily().id(),
                    config.angleCount() == 0 ? "auto" : config.angleCount(), config.maxImageSize());

            enter(PipelineStage.PREPROCESSING);
            tracker.checkpoint(0, "Preparing image...");
            GrayImage gray = Preprocessor.toGray(image);
            tracker.checkpoint(4, "Equalizing histogram...");
            GrayImage equalized = Preprocessor.equalizeHistogram(gray);
            tracker.checkpoint(7, "Denoising...");
            GrayImage denoised = Preprocessor.denoise(equalized);
            GrayImage prepared = Preprocessor.downscale(denoised, config.maxImageSize());

            int angleCount = config.angleCount() > 0
                    ? config.angleCount()
                    : Math.max(prepared.width(), prepared.height());
            tracker.checkpoint(10, "Computing sinogram (Radon transform)...");
            Sinogram sinogram = ForwardProjector.project(prepared, Sinogram.evenAngles(angleCount),
                    config.rayNormalization());

            int outputSize = config.outputSize() != null
                    ? config.outputSize()
                    : Math.max(prepared.width(), prepared.height());
            GrayImage truth = new GrayImage(prepared.width(), prepared.height(),
                    ImageQuantizer.toLevels(prepared.pixels())).centeredOn(outputSize);

            return finish(new Prepared(sinogram, outputSize, truth));
        } catch (RuntimeException e) {
            throw fail(e);
        }
    }

    /**
     * Reconstructs from a sinogram raster: luminance is taken as the projection value, the width is
     * the detector count and the height the number of evenly spaced angles over [0,180).
     *
     * @param groundTruth optional reference in [0,1], must match the output size
     */
    public ReconstructionResult reconstructFromSinogram(RasterImage sinogramRaster, GrayImage groundTruth) {
        begin();
        try {
            InvalidInputException.require(sinogramRaster != null, "Sinogram raster is null");
            int outputSize = resolveOutputSize(sinogramRaster.width());
            validateGroundTruth(groundTruth, outputSize);
            logger.info("Starting reconstruction from a sinogram raster: {} detectors x {} angles. Filter={}",
                    sinogramRaster.width(), sinogramRaster.height(), config.filterFamily().id());

            enter(PipelineStage.PREPROCESSING);
            tracker.checkpoint(0, "Analyzing sinogram...");
            GrayImage normalized = Preprocessor.normalizeRange(Preprocessor.toGray(sinogramRaster));
            Sinogram sinogram = new Sinogram(normalized.width(), normalized.height(), normalized.pixels(),
                    Sinogram.evenAngles(normalized.height()));

            return finish(new Prepared(sinogram, outputSize, levelsOf(groundTruth)));
        } catch (RuntimeException e) {
            throw fail(e);
        }
    }

    /**
     * Reconstructs from projection data that needs no preprocessing, keeping its angle vector.
     *
     * @param groundTruth optional reference in [0,1], must match the output size
     */
    public ReconstructionResult reconstructFromSinogram(Sinogram sinogram, GrayImage groundTruth) {
        begin();
        try {
            InvalidInputException.require(sinogram != null, "Sinogram is null");
            int outputSize = resolveOutputSize(sinogram.detectorCount());
            validateGroundTruth(groundTruth, outputSize);
            logger.info("Starting reconstruction from {}. Filter={}", sinogram, config.filterFamily().id());

            enter(PipelineStage.PREPROCESSING);
            tracker.checkpoint(0, "Analyzing sinogram...");

            return finish(new Prepared(sinogram, outputSize, levelsOf(groundTruth)));
        } catch (RuntimeException e) {
            throw fail(e);
        }
    }

    private ReconstructionResult finish(Prepared prepared) {
        Sinogram sinogram = prepared.sinogram();

        enter(PipelineStage.FILTERING);
        tracker.checkpoint(FILTER_PERCENT, "Applying " + config.filterFamily().id() + " filter...");
        double[] kernel = FilterBank.makeKernel(sinogram.detectorCount(), config.filterFamily());
        Sinogram filtered = FilterBank.filterSinogram(sinogram, kernel);
        byte[] filteredView = config.includeFilteredSinogram()
                ? ImageQuantizer.linear(filtered.samples())
                : null;
        logger.info("[FILTER] {} kernel, {} taps, applied to {} projections",
                config.filterFamily().id(), kernel.length, sinogram.angleCount());

        enter(PipelineStage.BACK_PROJECTING);
        GrayImage reconstruction = BackProjector.reconstruct(filtered, prepared.outputSize(), config.parallel(),
                tracker, BACKPROJECTION_START, BACKPROJECTION_END);
        tracker.checkpoint(BACKPROJECTION_END, "Normalizing image...");
        byte[] output = ImageQuantizer.quantize(reconstruction.pixels(), config.displayMapping());

        QualityMetrics metrics = null;
        if (prepared.groundTruthLevels() != null) {
            enter(PipelineStage.EVALUATING);
            tracker.checkpoint(EVALUATION_PERCENT, "Evaluating quality...");
            GrayImage outputLevels = new GrayImage(prepared.outputSize(), prepared.outputSize(), levels(output));
            metrics = MetricsEvaluator.evaluate(prepared.groundTruthLevels(), outputLevels, config.windowedSsim());
        }

        tracker.checkpoint(100, "Done!");
        enter(PipelineStage.DONE);
        logger.info("[PIPELINE] Reconstruction finished: {}x{} from {} detectors x {} angles{}",
                prepared.outputSize(), prepared.outputSize(), sinogram.detectorCount(), sinogram.angleCount(),
                metrics != null ? String.format(", PSNR=%.2f dB", metrics.psnr()) : "");

        return new ReconstructionResult(output, prepared.outputSize(), filteredView, sinogram.detectorCount(),
                sinogram.angleCount(), config.filterFamily(), metrics, null);
    }

    private int resolveOutputSize(int detectorCount) {
        return config.outputSize() != null ? config.outputSize() : detectorCount;
    }

    private static void validateGroundTruth(GrayImage groundTruth, int outputSize) {
        if (groundTruth == null) {
            return;
        }
        InvalidInputException.require(groundTruth.width() == outputSize && groundTruth.height() == outputSize,
                "Ground truth is " + groundTruth.width() + "x" + groundTruth.height()
                        + " but the output is " + outputSize + "x" + outputSize);
        for (double v : groundTruth.pixels()) {
            InvalidInputException.require(Double.isFinite(v), "Ground truth contains a non-finite sample");
        }
    }

    private static GrayImage levelsOf(GrayImage normalized) {
        if (normalized == null) {
            return null;
        }
        return new GrayImage(normalized.width(), normalized.height(), ImageQuantizer.toLevels(normalized.pixels()));
    }

    private static double[] levels(byte[] data) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] & 0xFF;
        }
        return out;
    }

    private void begin() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already used (stage " + stage + "); create a new one per run");
        }
    }

    private void enter(PipelineStage next) {
        boolean sequential = next.ordinal() == stage.ordinal() + 1
                || (stage == PipelineStage.BACK_PROJECTING && next == PipelineStage.DONE);
        if (!sequential) {
            throw new IllegalStateException("Illegal stage transition " + stage + " -> " + next);
        }
        logger.debug("[PIPELINE] {} -> {}", stage, next);
        stage = next;
    }

    private RuntimeException fail(RuntimeException e) {
        if (e instanceof ReconstructionCancelledException) {
            stage = PipelineStage.CANCELLED;
            logger.info("[PIPELINE] Reconstruction cancelled: {}", e.getMessage());
        } else {
            PipelineStage failedAt = stage;
            stage = PipelineStage.FAILED;
            logger.error("[PIPELINE] Reconstruction failed during {}: {}", failedAt, e.getMessage());
        }
        return e;
    }
}
