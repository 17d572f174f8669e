package com.leanspec.sync.server.auth;

import java.time.Instant;

import com.leanspec.sync.core.model.AccessToken;

/**
 * One pending device authorization. Held in memory only; a server restart forces bridges
 * that are mid-flow to request a new code.
 *
 * <p>States: requested, approved (token minted), exchanged, or expired once {@code expiresAt}
 * has passed.</p>
 */
public class DeviceCodeRecord {

    private final String deviceCode;
    private final String userCode;
    private final String machineLabel;
    private final Instant expiresAt;
    private final long intervalSeconds;
    private boolean approved;
    private AccessToken token;

    public DeviceCodeRecord(String deviceCode, String userCode, String machineLabel,
                            Instant expiresAt, long intervalSeconds) {
        this.deviceCode = deviceCode;
        this.userCode = userCode;
        this.machineLabel = machineLabel;
        this.expiresAt = expiresAt;
        this.intervalSeconds = intervalSeconds;
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    void approve(AccessToken token) {
        this.approved = true;
        this.token = token;
    }

    public String getDeviceCode() { return deviceCode; }
    public String getUserCode() { return userCode; }
    public String getMachineLabel() { return machineLabel; }
    public Instant getExpiresAt() { return expiresAt; }
    public long getIntervalSeconds() { return intervalSeconds; }
    public boolean isApproved() { return approved; }
    public AccessToken getToken() { return token; }
}
