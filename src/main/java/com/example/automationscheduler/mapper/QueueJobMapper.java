package com.example.automationscheduler.mapper;

import com.example.automationscheduler.domain.entity.JobExecutionLog;
import com.example.automationscheduler.domain.entity.QueuedJob;
import com.example.automationscheduler.dto.JobExecutionLogResponse;
import com.example.automationscheduler.dto.QueuedJobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper from queue entities to API DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface QueueJobMapper {

    QueuedJobResponse toResponse(QueuedJob job);

    List<QueuedJobResponse> toResponseList(List<QueuedJob> jobs);

    JobExecutionLogResponse toLogResponse(JobExecutionLog log);

    List<JobExecutionLogResponse> toLogResponses(List<JobExecutionLog> logs);
}
