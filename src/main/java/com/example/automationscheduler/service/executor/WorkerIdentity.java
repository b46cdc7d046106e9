package com.example.automationscheduler.service.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identifies this instance as the holder of job claims.
 */
@Slf4j
@Component
public class WorkerIdentity {

    private final String workerId;

    public WorkerIdentity(@Value("${HOSTNAME:unknown}") String hostname) {
        this.workerId = resolve(hostname);
        log.info("Queue worker id: {}", workerId);
    }

    public String getWorkerId() {
        return workerId;
    }

    private static String resolve(String hostname) {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
