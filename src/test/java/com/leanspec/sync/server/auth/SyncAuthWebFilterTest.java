package com.leanspec.sync.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SyncAuthWebFilterTest {

    @Test
    void guardsSyncApiExceptDeviceFlow() {
        assertThat(SyncAuthWebFilter.requiresAuth("/api/sync/events")).isTrue();
        assertThat(SyncAuthWebFilter.requiresAuth("/api/sync/machines/m1")).isTrue();
        assertThat(SyncAuthWebFilter.requiresAuth("/api/sync/bridge/ws")).isTrue();

        assertThat(SyncAuthWebFilter.requiresAuth("/api/sync/device/code")).isFalse();
        assertThat(SyncAuthWebFilter.requiresAuth("/api/sync/oauth/token")).isFalse();
        assertThat(SyncAuthWebFilter.requiresAuth("/actuator/health")).isFalse();
    }
}
