package com.aycom.explore.provider;

import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "explore.upstream")
public class UpstreamProperties {
    private String baseUrl = "http://localhost:8083/api/v1";
    private int connectTimeoutMs = 1000;
    private int readTimeoutMs = 5000;
    private int callTimeoutMs = 3000;
    private int maxProfileQueryLength = 30;
    private Map<ProviderKind, Integer> callTimeoutsMs = new EnumMap<>(ProviderKind.class);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(int callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public int getMaxProfileQueryLength() {
        return maxProfileQueryLength;
    }

    public void setMaxProfileQueryLength(int maxProfileQueryLength) {
        this.maxProfileQueryLength = maxProfileQueryLength;
    }

    public Map<ProviderKind, Integer> getCallTimeoutsMs() {
        return callTimeoutsMs;
    }

    public void setCallTimeoutsMs(Map<ProviderKind, Integer> callTimeoutsMs) {
        this.callTimeoutsMs = callTimeoutsMs;
    }

    public int resolveCallTimeoutMs(ProviderKind kind) {
        Integer override = callTimeoutsMs == null ? null : callTimeoutsMs.get(kind);
        return override != null ? override : callTimeoutMs;
    }
}
