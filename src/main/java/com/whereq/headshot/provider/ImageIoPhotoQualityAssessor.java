package com.whereq.headshot.provider;

import com.whereq.headshot.model.QualityAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Resolution and framing heuristics on the decoded source photo
 */
@Slf4j
@Service
public class ImageIoPhotoQualityAssessor implements PhotoQualityAssessor {

    static final int MIN_RECOMMENDED_EDGE = 512;

    @Override
    public Mono<QualityAssessment> assess(String imageBase64) {
        return Mono.fromCallable(() -> assessSync(imageBase64))
            .subscribeOn(Schedulers.boundedElastic());
    }

    QualityAssessment assessSync(String imageBase64) throws IOException {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(imageBase64);
        } catch (IllegalArgumentException e) {
            return unusable("Image data is not valid base64");
        }

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            return unusable("Unsupported or corrupt image format");
        }

        int shortEdge = Math.min(image.getWidth(), image.getHeight());
        int longEdge = Math.max(image.getWidth(), image.getHeight());
        double aspect = shortEdge == 0 ? Double.MAX_VALUE : (double) longEdge / shortEdge;

        List<String> recommendations = new ArrayList<>();
        int score = resolutionScore(shortEdge);
        if (shortEdge < MIN_RECOMMENDED_EDGE) {
            recommendations.add("Use a higher resolution photo (at least " + MIN_RECOMMENDED_EDGE
                + "px on the shortest side)");
        }
        if (aspect > 2.0) {
            score -= 20;
            recommendations.add("Crop the photo to a head-and-shoulders framing");
        } else if (aspect > 1.5) {
            score -= 10;
            recommendations.add("A squarer crop around the face gives better results");
        }
        score = Math.max(0, Math.min(100, score));

        log.debug("Assessed {}x{} image: score {}", image.getWidth(), image.getHeight(), score);

        return QualityAssessment.builder()
            .usable(true)
            .suitabilityScore(score)
            .qualityTier(QualityAssessment.tierFor(score))
            .recommendations(recommendations)
            .errors(List.of())
            .build();
    }

    private int resolutionScore(int shortEdge) {
        if (shortEdge >= 1024) {
            return 95;
        } else if (shortEdge >= 768) {
            return 85;
        } else if (shortEdge >= MIN_RECOMMENDED_EDGE) {
            return 72;
        } else if (shortEdge >= 256) {
            return 50;
        }
        return 25;
    }

    private QualityAssessment unusable(String reason) {
        return QualityAssessment.builder()
            .usable(false)
            .suitabilityScore(0)
            .qualityTier(QualityAssessment.tierFor(0))
            .recommendations(List.of())
            .errors(List.of(reason))
            .build();
    }
}
