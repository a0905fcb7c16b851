package com.realtime.messenger.presence.dto;

import jakarta.validation.constraints.NotBlank;

public record StatusRequest(@NotBlank String status) {}
