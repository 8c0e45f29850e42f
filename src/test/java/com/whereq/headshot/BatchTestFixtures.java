package com.whereq.headshot;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.model.BatchJob;
import com.whereq.headshot.model.BatchOptions;
import com.whereq.headshot.model.JobPriority;
import com.whereq.headshot.model.JobStatus;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Shared builders for batch job tests
 */
public final class BatchTestFixtures {

    /**
     * 600x600 PNG, usable but below the top resolution tier
     */
    public static final String SAMPLE_IMAGE = pngBase64(600, 600);

    private BatchTestFixtures() {
    }

    /**
     * Defaults with short timeouts so tests fail fast
     */
    public static HeadshotProperties properties(int maxConcurrentJobs) {
        HeadshotProperties properties = new HeadshotProperties();
        properties.getBatch().setMaxConcurrentJobs(maxConcurrentJobs);
        properties.getBatch().setTickInterval(Duration.ofMillis(50));
        properties.getBatch().setProviderTimeout(Duration.ofSeconds(5));
        properties.getBatch().setAssessmentTimeout(Duration.ofSeconds(5));
        properties.getBatch().setStoreTimeout(Duration.ofSeconds(5));
        properties.getBatch().setShutdownTimeout(Duration.ofMillis(500));
        properties.getStore().setType("memory");
        return properties;
    }

    public static BatchJob queuedJob(String id, JobPriority priority, Instant createdAt, String... styles) {
        return BatchJob.builder()
            .id(id)
            .ownerId("user-1")
            .batchType(HeadshotProperties.CUSTOM_BATCH)
            .requestedVariants(List.of(styles))
            .outputsPerVariant(2)
            .priority(priority)
            .status(JobStatus.QUEUED)
            .sourceImage(SAMPLE_IMAGE)
            .options(BatchOptions.empty())
            .createdAt(createdAt)
            .build();
    }

    public static String pngBase64(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Poll until the condition holds or the timeout elapses
     */
    public static boolean waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
