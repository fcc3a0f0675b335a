package com.eainde.compliance.mapper;

import com.eainde.compliance.model.ComplianceReport;
import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.PriorityMatrix;

import java.util.List;

public record MappingResult(List<MappedIssue> mappedIssues, ComplianceReport report, PriorityMatrix priorityMatrix) {

    public MappingResult {
        mappedIssues = List.copyOf(mappedIssues);
    }
}
