package apex4j.workers.env;

import java.util.Collections;
import java.util.Map;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Response of the environment to a single action.
 */
public class StepResult {
    private final INDArray nextState;
    private final double reward;
    private final boolean done;
    private final Map<String, Object> info;

    public StepResult(INDArray nextState, double reward, boolean done) {
        this(nextState, reward, done, Collections.<String, Object>emptyMap());
    }

    public StepResult(INDArray nextState, double reward, boolean done, Map<String, Object> info) {
        this.nextState = nextState;
        this.reward = reward;
        this.done = done;
        this.info = info == null ? Collections.<String, Object>emptyMap() : Collections.unmodifiableMap(info);
    }

    public INDArray getNextState() {
        return nextState;
    }

    public double getReward() {
        return reward;
    }

    public boolean isDone() {
        return done;
    }

    public Map<String, Object> getInfo() {
        return info;
    }

    @Override
    public String toString() {
        return "StepResult{" + "nextState=" + nextState + ", reward=" + reward + ", done=" + done + '}';
    }
}
