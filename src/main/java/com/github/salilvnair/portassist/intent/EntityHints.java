package com.github.salilvnair.portassist.intent;

import java.util.List;

public record EntityHints(
        List<String> expected,
        List<String> optional
) {

    public static final EntityHints NONE = new EntityHints(List.of(), List.of());

    public EntityHints {
        expected = expected == null ? List.of() : List.copyOf(expected);
        optional = optional == null ? List.of() : List.copyOf(optional);
    }
}
