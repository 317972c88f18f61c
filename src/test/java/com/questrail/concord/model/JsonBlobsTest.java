package com.questrail.concord.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonBlobsTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private static Map<String, Object> board() {
        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("a1", "rook");
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("cells", cells);
        state.put("history", new ArrayList<>(List.of("e4")));
        state.put("turn_count", 7L);
        return state;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> cells(Map<String, Object> state) {
        return (Map<String, Object>) state.get("cells");
    }

    @Test
    void copySharesNoNestedContainers() {
        Map<String, Object> source = board();
        Map<String, Object> copy = JsonBlobs.deepCopy(source);

        cells(source).put("a1", "queen");
        ((List<Object>) source.get("history")).add("e5");

        assertEquals("rook", cells(copy).get("a1"));
        assertEquals(List.of("e4"), copy.get("history"));
        assertEquals(7L, copy.get("turn_count"));
    }

    @Test
    void sessionIsolatedFromCallerMapsAfterCreation() {
        Map<String, Object> initial = board();
        Session session = new Session("s", "alice", "chess", initial, T0);

        cells(initial).put("a1", "queen");

        assertEquals("rook", cells(session.state()).get("a1"));
    }

    @Test
    void proposalPayloadCannotBeChangedThroughAccessor() {
        Proposal proposal = new Proposal("p", "alice", board(), T0, T0.plusSeconds(60));

        cells(proposal.payload()).put("a1", "queen");

        assertEquals("rook", cells(proposal.payload()).get("a1"));
    }

    @Test
    void rejectsValuesThatAreNotJson() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("thread", new Object());

        assertThrows(IllegalArgumentException.class, () -> JsonBlobs.deepCopy(state));
    }
}
