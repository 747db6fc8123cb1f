package io.downloader4j.core;

/**
 * One unit of work: a resource to download and a callback to notify once the download concludes.
 *
 * <p>The download sub-state is owned by the processor; the callback sub-state and
 * {@code callbackCount} are owned by the notifier.
 */
public class Job {

    private String id;
    private String aggrId;
    private String url;
    private String callbackUrl;
    private String extra = "";
    private Integer downloadTimeout;

    private JobState downloadState = JobState.PENDING;
    private String downloadMeta = "";

    private JobState callbackState = JobState.PENDING;
    private String callbackMeta = "";
    private int callbackCount;

    public Job() {
    }

    public Job(Job other) {
        this.id = other.id;
        this.aggrId = other.aggrId;
        this.url = other.url;
        this.callbackUrl = other.callbackUrl;
        this.extra = other.extra;
        this.downloadTimeout = other.downloadTimeout;
        this.downloadState = other.downloadState;
        this.downloadMeta = other.downloadMeta;
        this.callbackState = other.callbackState;
        this.callbackMeta = other.callbackMeta;
        this.callbackCount = other.callbackCount;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAggrId() {
        return aggrId;
    }

    public void setAggrId(String aggrId) {
        this.aggrId = aggrId;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public void setCallbackUrl(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    public String getExtra() {
        return extra;
    }

    public void setExtra(String extra) {
        this.extra = extra == null ? "" : extra;
    }

    /**
     * Download timeout in seconds, or {@code null} when the processor default applies.
     */
    public Integer getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Integer downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    public JobState getDownloadState() {
        return downloadState;
    }

    public void setDownloadState(JobState downloadState) {
        this.downloadState = downloadState;
    }

    public String getDownloadMeta() {
        return downloadMeta;
    }

    public void setDownloadMeta(String downloadMeta) {
        this.downloadMeta = downloadMeta == null ? "" : downloadMeta;
    }

    public JobState getCallbackState() {
        return callbackState;
    }

    public void setCallbackState(JobState callbackState) {
        this.callbackState = callbackState;
    }

    public String getCallbackMeta() {
        return callbackMeta;
    }

    public void setCallbackMeta(String callbackMeta) {
        this.callbackMeta = callbackMeta == null ? "" : callbackMeta;
    }

    public int getCallbackCount() {
        return callbackCount;
    }

    public void setCallbackCount(int callbackCount) {
        this.callbackCount = callbackCount;
    }

    @Override
    public String toString() {
        return "Job{id=" + id
                + ", aggrId=" + aggrId
                + ", downloadState=" + downloadState
                + ", callbackState=" + callbackState
                + ", callbackCount=" + callbackCount
                + "}";
    }
}
