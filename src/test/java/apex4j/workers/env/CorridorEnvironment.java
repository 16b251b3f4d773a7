package apex4j.workers.env;

import java.util.Random;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Deterministic 1-D corridor. The agent starts at a seeded position left of the goal,
 * moves left (0) or right (1) and gets 1 at the right end, -0.01 per step otherwise.
 * Episodes end at the goal or after maxSteps steps.
 */
public class CorridorEnvironment implements Environment {
    private final int length;
    private final int maxSteps;
    private final DiscreteActionSpace actionSpace;
    private Random rnd;
    private int pos;
    private int steps;
    private int resets;
    private boolean started;

    public CorridorEnvironment(int length, int maxSteps) {
        this.length = length;
        this.maxSteps = maxSteps;
        this.actionSpace = new DiscreteActionSpace(2);
        this.rnd = new Random(0L);
    }

    @Override
    public INDArray reset() {
        pos = rnd.nextInt(length - 1);
        steps = 0;
        resets++;
        started = true;
        return observation();
    }

    @Override
    public StepResult step(INDArray action) {
        if(!started)
            throw new IllegalStateException("step called before reset");
        int a = action.getInt(0);
        pos = a == 1 ? Math.min(pos + 1, length - 1) : Math.max(pos - 1, 0);
        steps++;
        boolean goal = pos == length - 1;
        boolean done = goal || steps >= maxSteps;
        if(done)
            started = false;
        return new StepResult(observation(), goal ? 1D : -0.01D, done);
    }

    private INDArray observation(){
        float[] obs = new float[length];
        obs[pos] = 1F;
        return Nd4j.create(obs);
    }

    @Override
    public void seed(long seed) {
        this.rnd = new Random(seed);
    }

    @Override
    public ActionSpace getActionSpace() {
        return actionSpace;
    }

    @Override
    public int getObservationSize() {
        return length;
    }

    public int getResets() {
        return resets;
    }
}
