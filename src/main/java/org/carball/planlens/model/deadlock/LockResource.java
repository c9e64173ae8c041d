package org.carball.planlens.model.deadlock;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LockResource {
    /** Element name in the report: keylock, pagelock, ridlock, objectlock... */
    String resourceType;
    String objectName;
    String indexName;
    String mode;

    @Builder.Default
    List<LockHolder> owners = List.of();

    @Builder.Default
    List<LockHolder> waiters = List.of();
}
