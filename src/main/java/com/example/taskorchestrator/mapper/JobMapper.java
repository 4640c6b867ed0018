package com.example.taskorchestrator.mapper;

import com.example.taskorchestrator.domain.entity.Job;
import com.example.taskorchestrator.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting jobs to API DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    JobResponse toResponse(Job job);
}
