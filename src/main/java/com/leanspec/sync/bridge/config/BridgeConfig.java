package com.leanspec.sync.bridge.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted bridge state ({@code bridge.json}).
 *
 * <pre>
 * {
 *   "serverUrl": "https://sync.example.com",
 *   "apiKey": null,
 *   "accessToken": "...",
 *   "machineId": "5f0c...",
 *   "machineLabel": "build-box",
 *   "projects": ["/work/app"]
 * }
 * </pre>
 *
 * <p><b>Security</b>: {@code apiKey} and {@code accessToken} are secrets; never log them.</p>
 */
public class BridgeConfig {

    public static final String DEFAULT_SERVER_URL = "http://localhost:3333";

    private String serverUrl = DEFAULT_SERVER_URL;
    private String apiKey;
    private String accessToken;
    private String machineId;
    private String machineLabel;
    private List<String> projects = new ArrayList<>();

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

    public String getMachineId() { return machineId; }
    public void setMachineId(String machineId) { this.machineId = machineId; }

    public String getMachineLabel() { return machineLabel; }
    public void setMachineLabel(String machineLabel) { this.machineLabel = machineLabel; }

    public List<String> getProjects() { return projects; }
    public void setProjects(List<String> projects) { this.projects = projects == null ? new ArrayList<>() : projects; }
}
