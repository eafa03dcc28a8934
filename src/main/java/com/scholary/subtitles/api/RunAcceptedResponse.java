package com.scholary.subtitles.api;

/** Response for a submitted project: the run id to poll and where to poll it. */
public record RunAcceptedResponse(String runId, String projectId, String statusUrl) {}
