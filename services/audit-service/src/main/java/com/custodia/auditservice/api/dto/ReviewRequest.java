package com.custodia.auditservice.api.dto;

public record ReviewRequest(String notes) {}
