package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.service.helper.ProcessHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jobs currently processed by this instance. A cancel flags the token, so
 * profiles not yet started are skipped, and kills any running encoder.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobCancellationRegistry {

    private final ProcessHelper processHelper;
    private final Map<String, CancellationToken> active = new ConcurrentHashMap<>();

    public CancellationToken register(String jobId) {
        CancellationToken token = new CancellationToken(jobId);
        active.put(jobId, token);
        return token;
    }

    public void unregister(String jobId) {
        active.remove(jobId);
    }

    /**
     * @return false when the job is not being processed here
     */
    public boolean cancel(String jobId) {
        CancellationToken token = active.get(jobId);
        if (token == null) {
            log.info("Cancel requested for job {} which is not running on this instance", jobId);
            return false;
        }
        if (token.cancel()) {
            log.info("Job {} cancelled", jobId);
            processHelper.stopProcesses(jobId);
        }
        return true;
    }

    public boolean isActive(String jobId) {
        return active.containsKey(jobId);
    }
}
