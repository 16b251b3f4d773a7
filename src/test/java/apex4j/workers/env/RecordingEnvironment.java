package apex4j.workers.env;

import java.util.ArrayList;
import java.util.List;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Wraps an environment and records every raw (state, reward, nextState, done) step.
 */
public class RecordingEnvironment implements Environment {
    private final Environment env;
    private final List<INDArray> states = new ArrayList<>();
    private final List<Double> rewards = new ArrayList<>();
    private final List<INDArray> nextStates = new ArrayList<>();
    private final List<Boolean> dones = new ArrayList<>();
    private INDArray current;

    public RecordingEnvironment(Environment env) {
        this.env = env;
    }

    @Override
    public INDArray reset() {
        current = env.reset();
        return current;
    }

    @Override
    public StepResult step(INDArray action) {
        StepResult r = env.step(action);
        states.add(current.dup());
        rewards.add(r.getReward());
        nextStates.add(r.getNextState().dup());
        dones.add(r.isDone());
        current = r.getNextState();
        return r;
    }

    @Override
    public void seed(long seed) {
        env.seed(seed);
    }

    @Override
    public ActionSpace getActionSpace() {
        return env.getActionSpace();
    }

    @Override
    public int getObservationSize() {
        return env.getObservationSize();
    }

    public List<INDArray> getStates() {
        return states;
    }

    public List<Double> getRewards() {
        return rewards;
    }

    public List<INDArray> getNextStates() {
        return nextStates;
    }

    public List<Boolean> getDones() {
        return dones;
    }
}
