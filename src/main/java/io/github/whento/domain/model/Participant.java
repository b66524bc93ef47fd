package io.github.whento.domain.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

@Value
@AllArgsConstructor(staticName = "of")
public class Participant {
    UUID id;
    String name;
}
