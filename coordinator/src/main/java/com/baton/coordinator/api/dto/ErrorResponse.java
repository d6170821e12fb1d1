package com.baton.coordinator.api.dto;

import com.baton.coordinator.service.ResultStatus;

/** Body returned for every non-OK command result. */
public record ErrorResponse(ResultStatus status, String message) {}
