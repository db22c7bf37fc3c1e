package com.questrail.assetexport.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * HandshakePolicy
 * -----------------------------------------------------------------------------
 * Timing and retry configuration for connecting to the rendering worker.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>settleDelay</b>: Wait between enabling the worker and reading its
 *       port. Only applied when the worker had to be switched on; an already
 *       running worker's port is read immediately.</li>
 *   <li><b>quickCheckTimeout</b>: Connect timeout of the debug-mode quick check
 *       that tries to reattach to a worker left running by a prior session.</li>
 *   <li><b>connectTimeout</b>: Connect timeout of a regular attempt.</li>
 *   <li><b>requestTimeout</b>: Maximum time a single worker call may take
 *       before it is failed.</li>
 *   <li><b>maxEnableAttempts</b>: Total enable-and-connect attempts before the
 *       worker is declared unavailable.</li>
 * </ul>
 */
public record HandshakePolicy(
        Duration settleDelay,
        Duration quickCheckTimeout,
        Duration connectTimeout,
        Duration requestTimeout,
        int maxEnableAttempts
) {
    public HandshakePolicy {
        Objects.requireNonNull(settleDelay, "settleDelay");
        Objects.requireNonNull(quickCheckTimeout, "quickCheckTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");

        if (settleDelay.isNegative()) {
            throw new IllegalArgumentException("settleDelay must be non-negative");
        }
        if (quickCheckTimeout.isNegative() || quickCheckTimeout.isZero()) {
            throw new IllegalArgumentException("quickCheckTimeout must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxEnableAttempts < 1) {
            throw new IllegalArgumentException("maxEnableAttempts must be >= 1");
        }
    }

    /**
     * Defaults matching observed worker start-up behaviour.
     *
     * <ul>
     *   <li>settleDelay: 3000ms</li>
     *   <li>quickCheckTimeout: 1000ms</li>
     *   <li>connectTimeout: 5000ms</li>
     *   <li>requestTimeout: 60s</li>
     *   <li>maxEnableAttempts: 2</li>
     * </ul>
     */
    public static HandshakePolicy defaults() {
        return new HandshakePolicy(
                Duration.ofMillis(3000),
                Duration.ofMillis(1000),
                Duration.ofMillis(5000),
                Duration.ofSeconds(60),
                2
        );
    }

    public HandshakePolicy withSettleDelay(Duration delay) {
        return new HandshakePolicy(delay, quickCheckTimeout, connectTimeout, requestTimeout, maxEnableAttempts);
    }
}
