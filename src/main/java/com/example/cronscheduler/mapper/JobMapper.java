package com.example.cronscheduler.mapper;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.JobExecutionLog;
import com.example.cronscheduler.dto.JobExecutionLogResponse;
import com.example.cronscheduler.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    @Mapping(target = "executionHistory", ignore = true)
    JobResponse toResponse(CronJob job);

    List<JobResponse> toResponseList(List<CronJob> jobs);

    JobExecutionLogResponse toLogResponse(JobExecutionLog log);

    List<JobExecutionLogResponse> toLogResponses(List<JobExecutionLog> logs);
}
