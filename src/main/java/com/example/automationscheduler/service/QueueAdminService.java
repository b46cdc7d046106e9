package com.example.automationscheduler.service;

import com.example.automationscheduler.domain.enums.QueueName;
import com.example.automationscheduler.domain.repository.JobExecutionLogRepository;
import com.example.automationscheduler.dto.JobExecutionLogResponse;
import com.example.automationscheduler.dto.QueueStatsResponse;
import com.example.automationscheduler.dto.QueuedJobResponse;
import com.example.automationscheduler.exception.JobNotFoundException;
import com.example.automationscheduler.mapper.QueueJobMapper;
import com.example.automationscheduler.queue.JobQueue;
import com.example.automationscheduler.queue.QueueException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Operational view of the queues: counts, dead letters, manual requeue and attempt history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueAdminService {

    private final JobQueue jobQueue;
    private final JobExecutionLogRepository executionLogRepository;
    private final QueueJobMapper mapper;

    public QueueStatsResponse getStats(QueueName queue) {
        return QueueStatsResponse.from(jobQueue.stats(queue));
    }

    public Page<QueuedJobResponse> getDeadLetters(QueueName queue, Pageable pageable) {
        return jobQueue.deadLetters(queue, pageable).map(mapper::toResponse);
    }

    public QueuedJobResponse getJob(UUID jobId) {
        return jobQueue.findJob(jobId)
                .map(mapper::toResponse)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Give a dead-lettered job a fresh attempt budget
     */
    public QueuedJobResponse requeue(UUID jobId) {
        try {
            var job = jobQueue.requeueDeadLetter(jobId);
            log.info("Dead-lettered job {} for automation {} requeued", jobId, job.getAutomationId());
            return mapper.toResponse(job);
        } catch (QueueException e) {
            if (e.getReason() == QueueException.Reason.JOB_NOT_FOUND) {
                throw new JobNotFoundException(jobId);
            }
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public List<JobExecutionLogResponse> getExecutions(UUID jobId) {
        return mapper.toLogResponses(executionLogRepository.findByJobIdOrderByStartedAtDesc(jobId));
    }

    @Transactional(readOnly = true)
    public Page<JobExecutionLogResponse> getAutomationExecutions(String automationId, Pageable pageable) {
        return executionLogRepository.findByAutomationIdOrderByStartedAtDesc(automationId, pageable).map(mapper::toLogResponse);
    }
}
