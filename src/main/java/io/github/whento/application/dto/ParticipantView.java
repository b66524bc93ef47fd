package io.github.whento.application.dto;

import java.util.UUID;

public record ParticipantView(UUID id, String name) {}
