package apex4j.workers.policy;

import apex4j.workers.env.DiscreteActionSpace;
import apex4j.workers.network.LinearQNetwork;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.api.rng.Random;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class EpsilonGreedyTest {
    LinearQNetwork network = new LinearQNetwork(new float[][]{{1F, 0F}, {0F, 2F}});
    INDArray left = Nd4j.create(new float[]{1F, 0F});
    INDArray right = Nd4j.create(new float[]{0F, 1F});

    private EpsilonGreedy policy(double max, double min, double decay, long seed){
        Random rnd = Nd4j.getRandomFactory().getNewRandomInstance(seed);
        return new EpsilonGreedy(max, min, decay, rnd, new DiscreteActionSpace(2, seed), network);
    }

    @Test
    void startsAtMaxEpsilon() {
        assertEquals(0.8D, policy(0.8D, 0.1D, 0.01D, 1L).getEpsilon());
    }

    @Test
    void linearDecayPerSelection() {
        EpsilonGreedy p = policy(1D, 0.01D, 1e-4, 7L);
        double expected = 1D;
        for(int i=0;i<500;i++){
            p.chooseAction(left);
            expected = Math.max(expected - (1D - 0.01D) * 1e-4, 0.01D);
            assertEquals(expected, p.getEpsilon(), 1e-12);
        }
        assertEquals(1D - 500 * 0.99e-4, p.getEpsilon(), 1e-9);
    }

    @Test
    void epsilonIsMonotonicAndFloored() {
        EpsilonGreedy p = policy(1D, 0.1D, 0.5D, 3L);
        double previous = p.getEpsilon();
        for(int i=0;i<10;i++){
            p.chooseAction(left);
            assertTrue(p.getEpsilon() <= previous);
            assertTrue(p.getEpsilon() >= 0.1D);
            previous = p.getEpsilon();
        }
        assertEquals(0.1D, p.getEpsilon(), 1e-12);
    }

    @Test
    void greedyWithoutExploration() {
        EpsilonGreedy p = policy(0D, 0D, 0D, 5L);
        for(int i=0;i<20;i++){
            assertEquals(0, p.chooseAction(left).getInt(0));
            assertEquals(1, p.chooseAction(right).getInt(0));
        }
    }

    @Test
    void fullExplorationSamplesActionSpace() {
        EpsilonGreedy p = policy(1D, 1D, 0D, 5L);
        Set<Integer> actions = new HashSet<>();
        for(int i=0;i<200;i++)
            actions.add(p.chooseAction(left).getInt(0));
        // greedy action for left is always 0
        assertTrue(actions.contains(1));
        assertEquals(1D, p.getEpsilon());
    }

    @Test
    void sameSeedSameActions() {
        EpsilonGreedy a = policy(1D, 0.01D, 1e-2, 11L);
        EpsilonGreedy b = policy(1D, 0.01D, 1e-2, 11L);
        for(int i=0;i<300;i++)
            assertEquals(a.chooseAction(left).getInt(0), b.chooseAction(left).getInt(0));
    }

    @Test
    void invalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> policy(0.1D, 0.5D, 0D, 1L));
        assertThrows(IllegalArgumentException.class, () -> policy(1.5D, 0.5D, 0D, 1L));
        assertThrows(IllegalArgumentException.class, () -> policy(1D, 0.5D, -1D, 1L));
    }
}
