package io.downloader4j.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.downloader4j.core.Job;
import io.downloader4j.core.JobValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

/**
 * Decodes a submitted job payload into a {@link Job}.
 * <p>
 * Accepted payload:
 * <pre>
 * {
 *   "aggr_id": "non-empty string",          required
 *   "url": "absolute URI",                  required
 *   "callback_url": "absolute URI",         required
 *   "extra": "any string",                  optional
 *   "download_timeout": positive integer    optional, but never null when present
 * }
 * </pre>
 * Nothing is defaulted beyond an empty {@code extra}; the decoded job has no id yet.
 */
public final class JobDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JobDecoder() {
    }

    public static Job decode(byte[] payload) {
        if (payload == null) {
            throw new JobValidationException("payload must not be null");
        }
        return decode(new String(payload, StandardCharsets.UTF_8));
    }

    /**
     * @throws JobValidationException when the payload is not a valid job
     */
    public static Job decode(String payload) {
        if (payload == null) {
            throw new JobValidationException("payload must not be null");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new JobValidationException("payload must be a JSON object");
        }

        Job job = new Job();
        job.setAggrId(requiredText(root, "aggr_id"));
        job.setUrl(requiredUri(root, "url"));
        job.setCallbackUrl(requiredUri(root, "callback_url"));
        job.setExtra(optionalText(root, "extra"));
        job.setDownloadTimeout(optionalTimeout(root));
        return job;
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new JobValidationException(field + " is required");
        }
        if (!node.isTextual()) {
            throw new JobValidationException(field + " must be a string");
        }
        String value = node.textValue();
        if (value.isEmpty()) {
            throw new JobValidationException(field + " must not be empty");
        }
        return value;
    }

    private static String requiredUri(JsonNode root, String field) {
        String value = requiredText(root, field);
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new JobValidationException(field + " is not a valid URI: " + value, e);
        }
        if (!uri.isAbsolute()) {
            throw new JobValidationException(field + " must be an absolute URI: " + value);
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isTextual()) {
            throw new JobValidationException(field + " must be a string");
        }
        return node.textValue();
    }

    private static Integer optionalTimeout(JsonNode root) {
        if (!root.has("download_timeout")) {
            return null;
        }
        JsonNode node = root.get("download_timeout");
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new JobValidationException("download_timeout must be an integer number of seconds");
        }
        int seconds = node.intValue();
        if (seconds <= 0) {
            throw new JobValidationException("download_timeout must be positive: " + seconds);
        }
        return seconds;
    }
}
