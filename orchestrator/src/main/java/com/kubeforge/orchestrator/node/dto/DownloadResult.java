package com.kubeforge.orchestrator.node.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from the node agent's POST /file/download.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DownloadResult(String path, String content) {}
