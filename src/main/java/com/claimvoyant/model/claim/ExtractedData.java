package com.claimvoyant.model.claim;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Raw content pulled out of the claim document by Intake.
 *
 * PDFs fill {@code text}; images fill {@code labels} and {@code detectedText}.
 * An unsupported file carries only {@code fileType = unknown} and an error.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractedData {

    @JsonProperty("file_type")
    FileType fileType;

    @JsonProperty("text")
    String text;

    @JsonProperty("detected_text")
    String detectedText;

    @JsonProperty("labels")
    @Builder.Default
    List<DetectedLabel> labels = List.of();

    @JsonProperty("job_id")
    String jobId;

    @JsonProperty("error")
    String error;

    /**
     * Text used for entity extraction: document text and text found in images.
     */
    @JsonIgnore
    public String combinedText() {
        String first = text != null ? text : "";
        String second = detectedText != null ? detectedText : "";
        return (first + " " + second).trim();
    }

    public static ExtractedData unsupported(String extension) {
        return ExtractedData.builder()
                .fileType(FileType.UNKNOWN)
                .error("Unsupported file type: " + extension)
                .build();
    }
}
