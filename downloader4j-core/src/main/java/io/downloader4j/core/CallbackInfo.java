package io.downloader4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Body posted to a job's callback URL once its download has concluded.
 */
@JsonPropertyOrder({"success", "error", "extra", "download_url"})
public record CallbackInfo(
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error,
        @JsonProperty("extra") String extra,
        @JsonProperty("download_url") String downloadUrl
) {
}
