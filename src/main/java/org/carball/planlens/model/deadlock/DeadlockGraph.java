package org.carball.planlens.model.deadlock;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.carball.planlens.model.plan.ParseOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Wait-for graph of a single deadlock report. When the XML could not be parsed
 * {@code parseError} is set and {@code rawXml} keeps the input for display.
 */
@Value
@Builder
public class DeadlockGraph {

    ParseOutcome outcome;

    @Builder.Default
    List<DeadlockParticipant> participants = List.of();

    @Builder.Default
    List<LockResource> resources = List.of();

    @Builder.Default
    List<WaitForEdge> edges = List.of();

    String victimId;

    @Builder.Default
    List<String> parseWarnings = List.of();

    String parseError;
    String rawXml;

    public static DeadlockGraph failed(String rawXml, String error) {
        return DeadlockGraph.builder()
                .outcome(ParseOutcome.UNRECOGNIZED)
                .rawXml(rawXml)
                .parseError(error)
                .build();
    }

    public boolean isFailed() {
        return parseError != null;
    }

    public Optional<DeadlockParticipant> findParticipant(String processId) {
        return participants.stream()
                .filter(p -> p.getProcessId().equals(processId))
                .findFirst();
    }

    @JsonIgnore
    public Optional<DeadlockParticipant> getVictim() {
        return participants.stream()
                .filter(DeadlockParticipant::isVictim)
                .findFirst();
    }
}
