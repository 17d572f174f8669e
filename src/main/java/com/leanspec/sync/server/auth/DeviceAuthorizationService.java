package com.leanspec.sync.server.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.leanspec.sync.core.error.SyncErrorKind;
import com.leanspec.sync.core.error.SyncException;
import com.leanspec.sync.core.model.AccessToken;
import com.leanspec.sync.server.config.SyncServerProperties;
import com.leanspec.sync.server.registry.MachineRegistry;

/**
 * Device-code flow for headless bridges.
 *
 * <pre>
 * bridge                         server                        operator
 *   |-- request(label) ----------->|                                |
 *   |<-- deviceCode, userCode -----|                                |
 *   |                              |<------ activate(userCode) -----|
 *   |-- exchange(deviceCode) ----->|  (authorization_pending until  |
 *   |<-- accessToken --------------|   activated, expired_token     |
 *   |                              |   after the TTL)               |
 * </pre>
 *
 * Device codes live in memory; minted tokens go to the persisted token table in
 * {@link MachineRegistry}.
 */
@Service
public class DeviceAuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAuthorizationService.class);

    static final String AUTHORIZATION_PENDING = "authorization_pending";
    static final String EXPIRED_TOKEN = "expired_token";

    private static final int USER_CODE_LENGTH = 8;

    private final MachineRegistry registry;
    private final Clock clock;
    private final SyncServerProperties props;
    private final SecureRandom random = new SecureRandom();

    private final Map<String, DeviceCodeRecord> byDeviceCode = new HashMap<>();
    private final Map<String, DeviceCodeRecord> byUserCode = new HashMap<>();

    public DeviceAuthorizationService(MachineRegistry registry, Clock clock, SyncServerProperties props) {
        this.registry = registry;
        this.clock = clock;
        this.props = props;
    }

    public synchronized DeviceCodeGrant requestDeviceCode(String machineLabel) {
        Instant now = clock.instant();
        prune(now);

        String deviceCode = UUID.randomUUID().toString();
        String userCode;
        do {
            userCode = UUID.randomUUID().toString().replace("-", "")
                    .substring(0, USER_CODE_LENGTH)
                    .toUpperCase(Locale.ROOT);
        } while (byUserCode.containsKey(userCode));

        Duration ttl = props.getDeviceCodeTtl();
        long interval = Math.max(1, props.getDeviceCodeInterval().toSeconds());
        DeviceCodeRecord record = new DeviceCodeRecord(deviceCode, userCode, machineLabel, now.plus(ttl), interval);
        byDeviceCode.put(deviceCode, record);
        byUserCode.put(userCode, record);

        log.info("Device code requested label={} userCode={} expiresAt={}", machineLabel, userCode, record.getExpiresAt());
        return new DeviceCodeGrant(deviceCode, userCode, props.getVerificationUri(), ttl.toSeconds(), interval);
    }

    /**
     * Approves the device code behind {@code userCode}. Repeating the call returns the token minted
     * the first time.
     */
    public synchronized AccessToken activate(String userCode) {
        if (userCode == null || userCode.isBlank()) {
            throw SyncException.invalid("userCode is required");
        }
        String key = userCode.trim().toUpperCase(Locale.ROOT);
        DeviceCodeRecord record = byUserCode.get(key);
        if (record == null) {
            throw SyncException.notFound("User code", key);
        }
        Instant now = clock.instant();
        if (record.isExpiredAt(now)) {
            throw expired();
        }
        if (record.isApproved()) {
            return record.getToken();
        }

        AccessToken token = mint(now);
        registry.storeToken(token);
        record.approve(token);
        log.info("Device code approved userCode={} label={}", key, record.getMachineLabel());
        return token;
    }

    public synchronized TokenGrant exchange(String deviceCode) {
        if (deviceCode == null || deviceCode.isBlank()) {
            throw SyncException.invalid("deviceCode is required");
        }
        DeviceCodeRecord record = byDeviceCode.get(deviceCode);
        if (record == null) {
            throw SyncException.notFound("Device code", deviceCode);
        }
        Instant now = clock.instant();
        if (record.isExpiredAt(now)) {
            throw expired();
        }
        if (!record.isApproved()) {
            throw new SyncException(SyncErrorKind.VALIDATION, AUTHORIZATION_PENDING, "Authorization pending");
        }

        AccessToken token = record.getToken();
        Long expiresIn = token.expiresAt() == null
                ? null
                : Math.max(0, Duration.between(now, token.expiresAt()).toSeconds());
        return new TokenGrant(token.token(), TokenGrant.BEARER, expiresIn);
    }

    private AccessToken mint(Instant now) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String value = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        Duration ttl = props.getTokenTtl();
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : now.plus(ttl);
        return new AccessToken(value, now, expiresAt);
    }

    /** Drops records that expired more than one TTL ago; recently expired ones still answer expired_token. */
    private void prune(Instant now) {
        Instant cutoff = now.minus(props.getDeviceCodeTtl());
        Iterator<DeviceCodeRecord> it = byDeviceCode.values().iterator();
        while (it.hasNext()) {
            DeviceCodeRecord record = it.next();
            if (record.getExpiresAt().isBefore(cutoff)) {
                it.remove();
                byUserCode.remove(record.getUserCode());
            }
        }
    }

    private static SyncException expired() {
        return new SyncException(SyncErrorKind.VALIDATION, EXPIRED_TOKEN, "Device code expired");
    }
}
