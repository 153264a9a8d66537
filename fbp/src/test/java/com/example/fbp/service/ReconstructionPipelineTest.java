package com.example.fbp.service;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.QualityMetrics;
import com.example.fbp.dto.RasterImage;
import com.example.fbp.dto.ReconstructionResult;
import com.example.fbp.dto.Sinogram;
import com.example.fbp.engine.CancellationToken;
import com.example.fbp.engine.DisplayMapping;
import com.example.fbp.engine.FilterFamily;
import com.example.fbp.engine.ForwardProjector;
import com.example.fbp.engine.ImageQuantizer;
import com.example.fbp.engine.MetricsEvaluator;
import com.example.fbp.engine.PhantomGenerator;
import com.example.fbp.engine.PhantomKind;
import com.example.fbp.engine.Preprocessor;
import com.example.fbp.engine.ProgressListener;
import com.example.fbp.engine.RayNormalization;
import com.example.fbp.exception.InvalidInputException;
import com.example.fbp.exception.ReconstructionCancelledException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconstructionPipelineTest {

    private static final ReconstructionConfig DISC_CONFIG = ReconstructionConfig.defaults()
            .withFilterFamily(FilterFamily.HANN)
            .withAngleCount(180)
            .withOutputSize(64);

    private static RasterImage discRaster() {
        return RasterImage.fromGray(PhantomGenerator.generate(PhantomKind.DISC, 64));
    }

    private static ReconstructionPipeline pipeline(ReconstructionConfig config) {
        return new ReconstructionPipeline(config, ProgressListener.NONE, CancellationToken.create());
    }

    /** Sinogram of a phantom as a gray image scaled into [0,1]. */
    private static GrayImage sinogramImage(PhantomKind kind, int size, int angles) {
        Sinogram sinogram = ForwardProjector.project(PhantomGenerator.generate(kind, size),
                Sinogram.evenAngles(angles));
        double[] samples = sinogram.samples();
        double max = 0;
        for (double v : samples) {
            max = Math.max(max, v);
        }
        return new GrayImage(sinogram.detectorCount(), sinogram.angleCount(), samples).scaled(1.0 / max);
    }

    @Test
    void testDiscReconstructionFromImage() {
        List<Integer> percents = new ArrayList<>();
        ReconstructionPipeline pipeline = new ReconstructionPipeline(DISC_CONFIG,
                (percent, message) -> percents.add(percent), CancellationToken.create());

        ReconstructionResult result = pipeline.reconstructFromImage(discRaster());

        assertEquals(PipelineStage.DONE, pipeline.stage());
        assertEquals(64, result.size());
        assertEquals(64 * 64, result.imageData().length);
        assertEquals(180, result.angleCount());
        assertEquals(ForwardProjector.detectorCount(64, 64), result.detectorCount());
        assertEquals(FilterFamily.HANN, result.filterUsed());
        assertTrue(result.filteredSinogramData().isPresent());
        assertEquals(result.detectorCount() * result.angleCount(), result.filteredSinogram().length);

        double psnr = result.qualityMetrics().orElseThrow().psnr();
        assertTrue(psnr > 15.0, "PSNR too low: " + psnr);
        assertTrue(result.grayLevel(32, 32) > result.grayLevel(2, 2));

        assertEquals(0, percents.get(0));
        assertEquals(100, percents.get(percents.size() - 1));
        for (int i = 1; i < percents.size(); i++) {
            assertTrue(percents.get(i) >= percents.get(i - 1), "progress went backwards: " + percents);
        }
    }

    @Test
    void testAutomaticSizesFromImage() {
        ReconstructionResult result = pipeline(ReconstructionConfig.defaults().withMaxImageSize(16))
                .reconstructFromImage(RasterImage.fromGray(PhantomGenerator.generate(PhantomKind.SQUARE, 32)));
        assertEquals(16, result.size());
        assertEquals(16, result.angleCount());
        assertEquals(ForwardProjector.detectorCount(16, 16), result.detectorCount());
    }

    @Test
    void testParallelMatchesSequential() {
        ReconstructionResult parallel = pipeline(DISC_CONFIG.withParallel(true)).reconstructFromImage(discRaster());
        ReconstructionResult sequential = pipeline(DISC_CONFIG.withParallel(false)).reconstructFromImage(discRaster());
        assertArrayEquals(sequential.imageData(), parallel.imageData());
    }

    @Test
    void testSinogramRasterWithoutGroundTruth() {
        GrayImage sinogram = sinogramImage(PhantomKind.SQUARE, 32, 60);
        ReconstructionPipeline pipeline = pipeline(ReconstructionConfig.defaults());

        ReconstructionResult result = pipeline.reconstructFromSinogram(RasterImage.fromGray(sinogram), null);

        assertEquals(PipelineStage.DONE, pipeline.stage());
        assertTrue(result.qualityMetrics().isEmpty());
        assertEquals(sinogram.width(), result.size());
        assertEquals(sinogram.width(), result.detectorCount());
        assertEquals(60, result.angleCount());
    }

    @Test
    void testConstantSinogramGivesMidGray() {
        RasterImage flat = RasterImage.fromGray(GrayImage.filled(20, 10, 0.7));
        ReconstructionResult result = pipeline(ReconstructionConfig.defaults()).reconstructFromSinogram(flat, null);
        for (byte level : result.imageData()) {
            assertEquals(ImageQuantizer.MID_GRAY, level & 0xFF);
        }
    }

    @Test
    void testExplicitSinogramWithGroundTruth() {
        GrayImage disc = PhantomGenerator.generate(PhantomKind.DISC, 64);
        Sinogram sinogram = ForwardProjector.project(disc, Sinogram.evenAngles(180));

        ReconstructionResult result = pipeline(ReconstructionConfig.defaults().withOutputSize(64))
                .reconstructFromSinogram(sinogram, disc);

        assertEquals(64, result.size());
        assertEquals(sinogram.detectorCount(), result.detectorCount());
        double psnr = result.qualityMetrics().orElseThrow().psnr();
        assertTrue(psnr > 15.0, "PSNR too low: " + psnr);
    }

    @Test
    void testWindowedSsimIsReported() {
        RasterImage raster = discRaster();
        ReconstructionResult result = pipeline(DISC_CONFIG.withWindowedSsim(true)).reconstructFromImage(raster);

        GrayImage truth = new GrayImage(64, 64, ImageQuantizer.toLevels(Preprocessor.preprocess(raster).pixels()));
        GrayImage output = result.toGrayImage();
        QualityMetrics metrics = result.qualityMetrics().orElseThrow();
        assertEquals(MetricsEvaluator.windowedSsim(truth, output), metrics.ssim(), 1e-9);
        assertEquals(MetricsEvaluator.psnr(truth, output), metrics.psnr(), 1e-9);
    }

    @Test
    void testMeanRescaledRays() {
        ReconstructionPipeline pipeline = pipeline(DISC_CONFIG.withRayNormalization(RayNormalization.MEAN_RESCALED));
        ReconstructionResult result = pipeline.reconstructFromImage(discRaster());

        assertEquals(PipelineStage.DONE, pipeline.stage());
        assertTrue(result.grayLevel(32, 32) > result.grayLevel(2, 2));
        double psnr = result.qualityMetrics().orElseThrow().psnr();
        assertTrue(psnr > 12.0, "PSNR too low: " + psnr);
    }

    @Test
    void testPercentileGammaDisplayMapping() {
        ReconstructionResult result = pipeline(DISC_CONFIG.withDisplayMapping(DisplayMapping.PERCENTILE_GAMMA))
                .reconstructFromImage(discRaster());

        int min = 255;
        int max = 0;
        for (byte level : result.imageData()) {
            min = Math.min(min, level & 0xFF);
            max = Math.max(max, level & 0xFF);
        }
        assertEquals(0, min);
        assertEquals(255, max);
        assertTrue(result.grayLevel(32, 32) > result.grayLevel(2, 2));
    }

    @Test
    void testTwoDetectorSinogramWithDefaultFilter() {
        double[] rows = new double[2 * 4];
        for (int a = 0; a < 4; a++) {
            rows[a * 2] = 1.0;
        }
        RasterImage raster = RasterImage.fromGray(new GrayImage(2, 4, rows));

        ReconstructionResult result = pipeline(ReconstructionConfig.defaults()).reconstructFromSinogram(raster, null);

        assertEquals(FilterFamily.HANN, result.filterUsed());
        assertEquals(2, result.size());
        byte[] image = result.imageData();
        boolean uniform = true;
        for (byte level : image) {
            uniform &= level == image[0];
        }
        assertFalse(uniform, "a two-tap kernel must not flatten the image");
    }

    @Test
    void testWrongGroundTruthFailsBeforeAnyProgress() {
        List<Integer> percents = new ArrayList<>();
        ReconstructionPipeline pipeline = new ReconstructionPipeline(ReconstructionConfig.defaults().withOutputSize(32),
                (percent, message) -> percents.add(percent), CancellationToken.create());
        Sinogram sinogram = ForwardProjector.project(GrayImage.filled(16, 16, 1.0), Sinogram.evenAngles(8));

        assertThrows(InvalidInputException.class,
                () -> pipeline.reconstructFromSinogram(sinogram, GrayImage.filled(16, 16, 0.5)));
        assertEquals(PipelineStage.FAILED, pipeline.stage());
        assertTrue(percents.isEmpty());
    }

    @Test
    void testCancellationDuringBackProjection() {
        CancellationToken token = CancellationToken.create();
        ReconstructionPipeline pipeline = new ReconstructionPipeline(DISC_CONFIG, (percent, message) -> {
            if (percent >= 50) {
                token.cancel();
            }
        }, token);

        ReconstructionCancelledException e = assertThrows(ReconstructionCancelledException.class,
                () -> pipeline.reconstructFromImage(discRaster()));
        assertEquals(PipelineStage.CANCELLED, pipeline.stage());
        assertEquals(50, e.getPercentReached());
    }

    @Test
    void testPipelineIsSingleUse() {
        ReconstructionPipeline pipeline = pipeline(ReconstructionConfig.defaults().withMaxImageSize(8));
        RasterImage image = RasterImage.fromGray(PhantomGenerator.generate(PhantomKind.DISC, 8));
        pipeline.reconstructFromImage(image);
        assertThrows(IllegalStateException.class, () -> pipeline.reconstructFromImage(image));
        assertEquals(PipelineStage.DONE, pipeline.stage());
    }

    @Test
    void testNullInputIsRejected() {
        ReconstructionPipeline pipeline = pipeline(ReconstructionConfig.defaults());
        assertThrows(InvalidInputException.class, () -> pipeline.reconstructFromImage(null));
        assertEquals(PipelineStage.FAILED, pipeline.stage());
    }
}
