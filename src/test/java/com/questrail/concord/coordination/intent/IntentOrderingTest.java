package com.questrail.concord.coordination.intent;

import com.questrail.concord.model.Intent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentOrderingTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private static Intent intent(String id, int priority, long secondsAfterT0) {
        return new Intent(id, "peer-" + id, "door-7", "open", 0, priority, T0.plusSeconds(secondsAfterT0));
    }

    @Test
    void higherPriorityThenEarlierCreationWins() {
        Intent late = intent("a", 5, 10);
        Intent early = intent("b", 5, 5);
        Intent lowPriority = intent("c", 3, 1);

        List<Intent> ranked = IntentOrdering.rank(List.of(late, early, lowPriority));

        assertEquals(List.of(early, late, lowPriority), ranked);
    }

    @Test
    void identicalPriorityAndTimeFallBackToId() {
        Intent x = intent("x-2", 4, 0);
        Intent y = intent("x-10", 4, 0);

        assertSame(y, IntentOrdering.rank(List.of(x, y)).get(0), "\"x-10\" sorts before \"x-2\"");
    }

    @Test
    void rankDoesNotMutateInput() {
        List<Intent> input = List.of(intent("a", 1, 0), intent("b", 9, 0));
        IntentOrdering.rank(input);
        assertEquals("a", input.get(0).id());
    }

    @Test
    void roundIdIsIndependentOfCandidateOrder() {
        String one = IntentOrdering.roundId("door-7", List.of("a", "b", "c"));
        String two = IntentOrdering.roundId("door-7", List.of("c", "a", "b"));

        assertEquals(one, two);
        assertTrue(one.startsWith("round-"));
        assertEquals("round-".length() + 32, one.length());
    }

    @Test
    void roundIdDependsOnResourceAndCandidates() {
        String base = IntentOrdering.roundId("door-7", List.of("a", "b"));

        assertNotEquals(base, IntentOrdering.roundId("door-8", List.of("a", "b")));
        assertNotEquals(base, IntentOrdering.roundId("door-7", List.of("a", "b", "c")));
    }
}
