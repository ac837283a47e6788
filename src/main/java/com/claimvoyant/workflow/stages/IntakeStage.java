package com.claimvoyant.workflow.stages;

import com.claimvoyant.client.ContentIndexClient;
import com.claimvoyant.client.ImageAnalysisClient;
import com.claimvoyant.client.TextExtractionClient;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.configuration.PipelineProperties;
import com.claimvoyant.exception.ClaimInputException;
import com.claimvoyant.model.PipelineStage;
import com.claimvoyant.model.audit.AuditStatus;
import com.claimvoyant.model.claim.ClaimContext;
import com.claimvoyant.model.claim.ClaimEntities;
import com.claimvoyant.model.claim.DetectedLabel;
import com.claimvoyant.model.claim.ExtractedData;
import com.claimvoyant.model.claim.FileType;
import com.claimvoyant.model.claim.StorageLocation;
import com.claimvoyant.service.AuditLoggingService;
import com.claimvoyant.service.ClaimIdGenerator;
import com.claimvoyant.workflow.assessment.ClaimEntityExtractor;
import com.claimvoyant.workflow.pipeline.AbstractClaimStage;
import com.claimvoyant.workflow.pipeline.StageResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 1: reads the uploaded document and extracts claim entities.
 *
 * <p>PDFs go to text extraction, JPEG/PNG images to label and text detection.
 * Other file types are not an error: the stage completes with
 * {@code file_type = unknown} and lets the rest of the pipeline reason about it.
 * The extracted content is also pushed to the content index; a failure there is
 * recorded in the audit details only.
 */
@Slf4j
@Component
@Order(1)
public class IntakeStage extends AbstractClaimStage {

    private final ClaimIdGenerator idGenerator;
    private final TextExtractionClient textExtractionClient;
    private final ImageAnalysisClient imageAnalysisClient;
    private final ContentIndexClient contentIndexClient;
    private final ClaimEntityExtractor entityExtractor;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    public IntakeStage(AuditLoggingService auditService,
                       ClaimIdGenerator idGenerator,
                       TextExtractionClient textExtractionClient,
                       ImageAnalysisClient imageAnalysisClient,
                       ContentIndexClient contentIndexClient,
                       ClaimEntityExtractor entityExtractor,
                       AppProperties props,
                       ObjectMapper objectMapper) {
        super(auditService);
        this.idGenerator = idGenerator;
        this.textExtractionClient = textExtractionClient;
        this.imageAnalysisClient = imageAnalysisClient;
        this.contentIndexClient = contentIndexClient;
        this.entityExtractor = entityExtractor;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.INTAKE;
    }

    @Override
    protected ClaimContext prepare(ClaimContext context) {
        if (context.hasClaimId()) {
            return context;
        }
        String claimId = idGenerator.nextId();
        log.info("Assigned claim id {}", claimId);
        return context.withClaimId(claimId);
    }

    @Override
    protected void checkPrerequisites(ClaimContext context) {
        super.checkPrerequisites(context);
        StorageLocation location = context.getSourceLocation();
        if (location == null || !location.isComplete()) {
            throw new ClaimInputException("Missing bucket or key in claim source location");
        }
    }

    @Override
    protected StageResult.Completed process(ClaimContext context) {
        StorageLocation location = context.getSourceLocation();
        String extension = location.extension();
        FileType fileType = FileType.forExtension(extension);
        log.info("📥 Processing claim {}: {} ({})", context.getClaimId(), location, fileType.getValue());

        ExtractedData extracted = switch (fileType) {
            case PDF -> extractDocument(location);
            case IMAGE -> analyzeImage(location);
            case UNKNOWN -> ExtractedData.unsupported(extension);
        };

        ClaimEntities entities = entityExtractor.extract(extracted.combinedText());
        ClaimContext next = context.withIntake(extracted, entities);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("bucket", location.bucket());
        details.put("key", location.key());
        details.put("file_type", fileType.getValue());
        details.put("entities", toMap(entities));
        if (fileType == FileType.UNKNOWN) {
            details.put("unsupported_type", true);
            details.put("error", extracted.getError());
        }
        indexArtifact(next, details);

        return StageResult.completed(next, AuditStatus.SUCCESS, details);
    }

    @Override
    protected Map<String, Object> failureDetails(ClaimContext context, RuntimeException error) {
        Map<String, Object> details = super.failureDetails(context, error);
        StorageLocation location = context.getSourceLocation();
        if (location != null) {
            details.put("bucket", location.bucket());
            details.put("key", location.key());
        }
        return details;
    }

    private ExtractedData extractDocument(StorageLocation location) {
        TextExtractionClient.ExtractedText result = textExtractionClient.extractText(location.bucket(), location.key());
        return ExtractedData.builder()
                .fileType(FileType.PDF)
                .text(result.text())
                .jobId(result.jobId())
                .build();
    }

    private ExtractedData analyzeImage(StorageLocation location) {
        PipelineProperties pipeline = props.getPipeline();
        List<DetectedLabel> labels = imageAnalysisClient.detectLabels(location.bucket(), location.key(),
                pipeline.getMaxLabels(), pipeline.getMinLabelConfidence());
        String detectedText = imageAnalysisClient.detectText(location.bucket(), location.key());
        return ExtractedData.builder()
                .fileType(FileType.IMAGE)
                .labels(labels)
                .detectedText(detectedText)
                .build();
    }

    private void indexArtifact(ClaimContext context, Map<String, Object> details) {
        StorageLocation location = context.getSourceLocation();
        ExtractedData extracted = context.getExtractedData();
        try {
            String text = extracted.combinedText();
            int limit = props.getPipeline().getIndexTextLimit();
            if (text.length() > limit) {
                text = text.substring(0, limit);
            }
            contentIndexClient.index(new ContentIndexClient.ClaimArtifact(
                    context.getClaimId(),
                    location.bucket(),
                    location.key(),
                    extracted.getFileType().getValue(),
                    text,
                    objectMapper.writeValueAsString(context.getEntities()),
                    objectMapper.writeValueAsString(extracted)));
            details.put("index_status", "indexed");
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Content index failed for {}, continuing: {}", context.getClaimId(), e.getMessage());
            details.put("index_status", "failed");
            details.put("index_error", String.valueOf(e.getMessage()));
        }
    }

    private Map<String, Object> toMap(ClaimEntities entities) {
        return objectMapper.convertValue(entities, new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }
}
