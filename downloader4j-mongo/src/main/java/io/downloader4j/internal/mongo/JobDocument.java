package io.downloader4j.internal.mongo;

import io.downloader4j.core.JobState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Mongo document model for persisted download jobs.
 */
@Document(collection = "download_jobs")
public class JobDocument {

    @Id
    private String id;

    private String aggrId;
    private String url;
    private String callbackUrl;
    private String extra;
    private Integer downloadTimeout;

    private JobState downloadState;
    private String downloadMeta;

    private JobState callbackState;
    private String callbackMeta;
    private int callbackCount;

    public JobDocument() {
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
        this.extra = extra;
    }

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
        this.downloadMeta = downloadMeta;
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
        this.callbackMeta = callbackMeta;
    }

    public int getCallbackCount() {
        return callbackCount;
    }

    public void setCallbackCount(int callbackCount) {
        this.callbackCount = callbackCount;
    }
}
