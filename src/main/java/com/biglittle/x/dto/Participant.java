package com.biglittle.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class Participant {
    private final String id;

    /** Maximum simultaneous matches, only honoured by the weighted variant. */
    @Builder.Default
    private final int capacity = 1;

    public static Participant of(String id) {
        return new Participant(id, 1);
    }

    public static Participant of(String id, int capacity) {
        return new Participant(id, capacity);
    }
}
