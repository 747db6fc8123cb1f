package io.downloader4j.utils;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds the client-facing links under which finished downloads are served.
 */
public final class DownloadUrls {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private DownloadUrls() {
    }

    /**
     * Parse the configured base download URL.
     *
     * @throws IllegalArgumentException when the value is not an absolute URL with a host
     */
    public static URI parseBase(String downloadUrl) {
        Objects.requireNonNull(downloadUrl, "downloadUrl must not be null");
        URI uri;
        try {
            uri = new URI(downloadUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Could not parse download URL: " + e.getMessage(), e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new IllegalArgumentException("Download URL must be an absolute URL: " + downloadUrl);
        }
        return uri;
    }

    /**
     * Join the base URL's path with {@code jobId} as the final path segment.
     * The base URL is kept exactly as configured, including its encoding, query and fragment.
     * The job id is percent-encoded.
     */
    public static String resolve(URI base, String jobId) {
        Objects.requireNonNull(base, "base must not be null");
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }

        String path = base.getRawPath() == null ? "" : base.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder()
                .append(base.getScheme())
                .append("://")
                .append(base.getRawAuthority())
                .append(path)
                .append('/')
                .append(encodeSegment(jobId));
        if (base.getRawQuery() != null) {
            sb.append('?').append(base.getRawQuery());
        }
        if (base.getRawFragment() != null) {
            sb.append('#').append(base.getRawFragment());
        }
        return sb.toString();
    }

    // RFC 3986 unreserved characters pass through, every other byte is percent-encoded.
    private static String encodeSegment(String segment) {
        StringBuilder sb = new StringBuilder();
        for (byte b : segment.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xFF);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~') {
                sb.append(c);
            } else {
                sb.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
        }
        return sb.toString();
    }
}
