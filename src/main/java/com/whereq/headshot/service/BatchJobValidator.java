package com.whereq.headshot.service;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.dto.BatchJobRequest;
import com.whereq.headshot.exception.BatchValidationException;
import com.whereq.headshot.model.JobPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Validates batch submissions and expands presets into a style list.
 *
 * All problems found are reported together in one {@link BatchValidationException}.
 */
@Slf4j
@Component
public class BatchJobValidator {

    private final HeadshotProperties.BatchConfig config;

    public BatchJobValidator(HeadshotProperties properties) {
        this.config = properties.getBatch();
    }

    /**
     * @param request submission
     * @param ownerId caller identity
     * @return the resolved batch shape
     * @throws BatchValidationException if the submission is malformed
     */
    public ResolvedBatch validate(BatchJobRequest request, String ownerId) {
        List<String> errors = new ArrayList<>();

        if (ownerId == null || ownerId.isBlank()) {
            errors.add("ownerId is required");
        }
        validateImage(request.getImageBase64(), errors);

        String batchType = request.getBatchType();
        List<String> customStyles = request.getStyles() != null ? request.getStyles() : List.of();
        if (batchType == null || batchType.isBlank()) {
            batchType = HeadshotProperties.CUSTOM_BATCH;
        }

        HeadshotProperties.PresetConfig preset = config.getPresets().get(batchType);
        if (preset == null) {
            errors.add("Unknown batch type: " + batchType);
            throw new BatchValidationException(errors);
        }

        List<String> styles;
        int outputsPerVariant;
        if (HeadshotProperties.CUSTOM_BATCH.equals(batchType)) {
            styles = customStyles;
            outputsPerVariant = request.getOutputsPerVariant() != null
                ? request.getOutputsPerVariant()
                : preset.getOutputsPerStyle() > 0 ? preset.getOutputsPerStyle() : config.getDefaultOutputsPerVariant();
        } else {
            if (!customStyles.isEmpty()) {
                log.debug("Ignoring {} custom styles for preset {}", customStyles.size(), batchType);
            }
            styles = preset.getStyles() != null ? preset.getStyles() : List.of();
            outputsPerVariant = preset.getOutputsPerStyle();
        }

        validateStyles(styles, errors);
        if (outputsPerVariant < 1 || outputsPerVariant > config.getMaxOutputsPerVariant()) {
            errors.add("outputsPerVariant must be between 1 and " + config.getMaxOutputsPerVariant());
        }

        if (!errors.isEmpty()) {
            throw new BatchValidationException(errors);
        }

        JobPriority priority = request.getPriority() != null
            ? request.getPriority()
            : preset.getPriority() != null ? preset.getPriority() : JobPriority.MEDIUM;

        return new ResolvedBatch(batchType, List.copyOf(styles), outputsPerVariant, priority);
    }

    private void validateImage(String imageBase64, List<String> errors) {
        if (imageBase64 == null || imageBase64.isBlank()) {
            errors.add("imageBase64 is required");
            return;
        }
        try {
            Base64.getDecoder().decode(imageBase64);
        } catch (IllegalArgumentException e) {
            errors.add("imageBase64 is not valid base64");
        }
    }

    private void validateStyles(List<String> styles, List<String> errors) {
        if (styles.isEmpty()) {
            errors.add("At least one style is required");
            return;
        }
        if (styles.size() > config.getMaxVariantsPerJob()) {
            errors.add("At most " + config.getMaxVariantsPerJob() + " styles per job");
        }
        if (styles.stream().anyMatch(style -> style == null || style.isBlank())) {
            errors.add("Style identifiers must not be blank");
        }
    }
}
