package com.eios.collab.api.dto;

import java.util.Map;

public record HealthResponse(String status, String instanceId, int rooms, int sessions, Map<String, String> checks) {}
