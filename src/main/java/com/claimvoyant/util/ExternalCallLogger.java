package com.claimvoyant.util;

import com.claimvoyant.model.CallContext;
import com.claimvoyant.model.ServiceType;
import org.slf4j.Logger;

/**
 * Logging helpers shared by every capability adapter (S3, Textract,
 * Rekognition, Weaviate, Gemini, Secrets Manager).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (prompts, extracted text).
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
