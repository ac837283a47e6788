package com.claimvoyant.client.impl;

import com.claimvoyant.client.TextExtractionClient;
import com.claimvoyant.configuration.AppProperties;
import com.claimvoyant.configuration.AwsProperties;
import com.claimvoyant.exception.CapabilityException;
import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import com.claimvoyant.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DocumentLocation;
import software.amazon.awssdk.services.textract.model.GetDocumentTextDetectionRequest;
import software.amazon.awssdk.services.textract.model.GetDocumentTextDetectionResponse;
import software.amazon.awssdk.services.textract.model.JobStatus;
import software.amazon.awssdk.services.textract.model.S3Object;
import software.amazon.awssdk.services.textract.model.StartDocumentTextDetectionRequest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Asynchronous Textract text detection.
 *
 * Starts a detection job, polls it every {@code app.aws.textract-poll-interval}
 * until it leaves IN_PROGRESS, then pages through the result with NextToken and
 * keeps the LINE blocks. A job still running after {@code app.aws.textract-max-wait}
 * is treated as a failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextractTextExtractionClient implements TextExtractionClient {

    private final TextractClient textractClient;
    private final AppProperties props;

    @Override
    public ExtractedText extractText(String bucket, String key) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.TEXTRACT, "documentTextDetection", log);
        callCtx.logRequest("Starting text detection", "Bucket", bucket, "Key", key);

        try {
            String jobId = textractClient.startDocumentTextDetection(StartDocumentTextDetectionRequest.builder()
                            .documentLocation(DocumentLocation.builder()
                                    .s3Object(S3Object.builder().bucket(bucket).name(key).build())
                                    .build())
                            .build())
                    .jobId();
            log.debug("Started Textract job {}", jobId);

            GetDocumentTextDetectionResponse first = awaitCompletion(jobId);
            List<String> lines = new ArrayList<>();
            collectLines(first, lines);

            String nextToken = first.nextToken();
            while (nextToken != null) {
                GetDocumentTextDetectionResponse page = textractClient.getDocumentTextDetection(
                        GetDocumentTextDetectionRequest.builder().jobId(jobId).nextToken(nextToken).build());
                collectLines(page, lines);
                nextToken = page.nextToken();
            }

            String text = String.join("\n", lines).trim();
            callCtx.logResponse("Text detected",
                    "Job", jobId,
                    "Lines", lines.size(),
                    "Text", ExternalCallLogger.truncate(text, 200));
            return new ExtractedText(text, jobId);

        } catch (SdkException e) {
            callCtx.logError(e.getMessage(), e);
            throw new CapabilityException(ServiceType.TEXTRACT, "documentTextDetection", e.getMessage(), e);
        } catch (CapabilityException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        }
    }

    private GetDocumentTextDetectionResponse awaitCompletion(String jobId) {
        AwsProperties aws = props.getAws();
        Duration pollInterval = aws.getTextractPollInterval();
        long deadline = System.nanoTime() + aws.getTextractMaxWait().toNanos();

        while (true) {
            GetDocumentTextDetectionResponse response = textractClient.getDocumentTextDetection(
                    GetDocumentTextDetectionRequest.builder().jobId(jobId).build());
            JobStatus status = response.jobStatus();

            if (status == JobStatus.SUCCEEDED || status == JobStatus.PARTIAL_SUCCESS) {
                return response;
            }
            if (status != JobStatus.IN_PROGRESS) {
                throw new CapabilityException(ServiceType.TEXTRACT, "documentTextDetection",
                        "job " + jobId + " ended with status " + status + ": " + response.statusMessage());
            }
            if (System.nanoTime() + pollInterval.toNanos() > deadline) {
                throw new CapabilityException(ServiceType.TEXTRACT, "documentTextDetection",
                        "job " + jobId + " still running after " + aws.getTextractMaxWait());
            }

            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CapabilityException(ServiceType.TEXTRACT, "documentTextDetection",
                        "interrupted while waiting for job " + jobId, e);
            }
        }
    }

    private static void collectLines(GetDocumentTextDetectionResponse response, List<String> lines) {
        for (Block block : response.blocks()) {
            if (block.blockType() == BlockType.LINE && block.text() != null) {
                lines.add(block.text());
            }
        }
    }
}
