package io.github.drompincen.chatrelay.gateway.config;

import io.github.drompincen.chatrelay.runtime.connection.ConnectionConfig;
import io.github.drompincen.chatrelay.runtime.connection.ConnectionRegistry;
import io.github.drompincen.chatrelay.runtime.file.FileLimits;
import io.github.drompincen.chatrelay.runtime.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Configuration
public class ConnectionConfiguration {

    /** Settings for accepted sockets: no dial-back, inactivity check on. */
    @Bean
    ConnectionConfig connectionConfig(
            @Value("${chatrelay.connection.max-reconnect-attempts:10}") int maxReconnectAttempts,
            @Value("${chatrelay.connection.initial-backoff:1s}") Duration initialBackoff,
            @Value("${chatrelay.connection.max-backoff:30s}") Duration maxBackoff,
            @Value("${chatrelay.connection.ping-interval:30s}") Duration pingInterval,
            @Value("${chatrelay.connection.pong-timeout:120s}") Duration pongTimeout,
            @Value("${chatrelay.connection.write-timeout:45s}") Duration writeTimeout,
            @Value("${chatrelay.connection.send-timeout:5s}") Duration sendTimeout,
            @Value("${chatrelay.connection.message-queue-size:1000}") int messageQueueSize,
            @Value("${chatrelay.connection.idle-timeout:5m}") Duration idleTimeout) {
        return new ConnectionConfig(maxReconnectAttempts, initialBackoff, maxBackoff, pingInterval,
                pongTimeout, writeTimeout, sendTimeout, messageQueueSize, idleTimeout, false);
    }

    @Bean
    RetryPolicy retryPolicy(
            @Value("${chatrelay.retry.max-attempts:3}") int maxAttempts,
            @Value("${chatrelay.retry.initial-backoff:2s}") Duration initialBackoff,
            @Value("${chatrelay.retry.max-backoff:30s}") Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
    }

    @Bean
    FileLimits fileLimits(
            @Value("${chatrelay.files.max-file-size:5MB}") DataSize maxFileSize,
            @Value("${chatrelay.files.max-total-size:50MB}") DataSize maxTotalSize,
            @Value("${chatrelay.files.max-files:50}") int maxFiles) {
        return new FileLimits(maxFileSize.toBytes(), maxTotalSize.toBytes(), maxFiles);
    }

    @Bean(destroyMethod = "closeAll")
    ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }
}
