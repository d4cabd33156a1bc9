package com.memic.sdk.service.project;

import com.memic.sdk.common.apiclient.memic.MemicApiClient;
import com.memic.sdk.dto.mapper.MemicResponseMapper;
import com.memic.sdk.model.Project;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class ProjectService {

    private final MemicApiClient apiClient;

    public List<Project> listProjects() {
        return apiClient.listProjects().stream()
                        .map(MemicResponseMapper::toProject)
                        .toList();
    }
}
