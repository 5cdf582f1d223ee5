package com.example.importscheduler.mapper;

import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.entity.ImportJobError;
import com.example.importscheduler.domain.entity.ImportJobLog;
import com.example.importscheduler.dto.ImportJobErrorResponse;
import com.example.importscheduler.dto.ImportJobLogResponse;
import com.example.importscheduler.dto.ImportJobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting import job entities to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ImportJobMapper {

    ImportJobResponse toResponse(ImportJob job);

    List<ImportJobResponse> toResponseList(List<ImportJob> jobs);

    ImportJobLogResponse toLogResponse(ImportJobLog log);

    List<ImportJobLogResponse> toLogResponses(List<ImportJobLog> logs);

    ImportJobErrorResponse toErrorResponse(ImportJobError error);

    List<ImportJobErrorResponse> toErrorResponses(List<ImportJobError> errors);
}
