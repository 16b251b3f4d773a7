package apex4j.workers.env;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscreteActionSpaceTest {

    @Test
    void sampleInRange() {
        DiscreteActionSpace space = new DiscreteActionSpace(3, 1L);
        for(int i=0;i<100;i++){
            int a = space.sample().getInt(0);
            assertTrue(a >= 0 && a < 3);
        }
        assertEquals(3, space.size());
    }

    @Test
    void seedResetsSequence() {
        DiscreteActionSpace space = new DiscreteActionSpace(4);
        space.seed(42L);
        int[] first = new int[20];
        for(int i=0;i<first.length;i++)
            first[i] = space.sample().getInt(0);
        space.seed(42L);
        for(int i=0;i<first.length;i++)
            assertEquals(first[i], space.sample().getInt(0));
    }

    @Test
    void action() {
        assertEquals(1L, DiscreteActionSpace.action(2).length());
        assertEquals(2, DiscreteActionSpace.action(2).getInt(0));
    }

    @Test
    void emptySpace() {
        assertThrows(IllegalArgumentException.class, () -> new DiscreteActionSpace(0));
    }

    @Test
    void stepResultInfoIsReadOnly() {
        StepResult r = new StepResult(DiscreteActionSpace.action(0), 1D, true);
        assertTrue(r.getInfo().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> r.getInfo().put("k", 1));
    }
}
