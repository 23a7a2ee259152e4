package com.campaignkeeper.model;

import java.util.Objects;

public record EntityUpsert(EntityKind kind, WorldEntity entity) {

    public EntityUpsert {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entity, "entity");
    }
}
