package quest.gekko.insights.web.dto;

import quest.gekko.insights.service.error.ErrorKind;

import java.time.Instant;

public record ApiError(ErrorKind kind, String message, int status, String path, Instant timestamp) {}
