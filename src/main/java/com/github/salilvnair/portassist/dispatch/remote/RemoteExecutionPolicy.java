package com.github.salilvnair.portassist.dispatch.remote;

import com.github.salilvnair.portassist.config.PortAssistConfig;

import java.util.List;

public record RemoteExecutionPolicy(
        int connectTimeoutMs,
        int readTimeoutMs,
        int maxAttempts,
        long initialBackoffMs,
        long maxBackoffMs,
        double backoffMultiplier,
        List<Integer> retryStatusCodes,
        boolean retryOnIOException
) {

    public static RemoteExecutionPolicy fromConfig(PortAssistConfig.Remote.Policy policy) {
        return new RemoteExecutionPolicy(
                Math.max(policy.getConnectTimeoutMs(), 100),
                Math.max(policy.getReadTimeoutMs(), 100),
                Math.max(policy.getMaxAttempts(), 1),
                Math.max(policy.getInitialBackoffMs(), 0),
                Math.max(policy.getMaxBackoffMs(), 0),
                Math.max(policy.getBackoffMultiplier(), 1.0d),
                policy.getRetryStatusCodes() == null ? List.of() : List.copyOf(policy.getRetryStatusCodes()),
                policy.isRetryOnIOException());
    }
}
