package apex4j.workers.memory;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * One environment step (s, a, r, s', done). Arrays are copied on construction
 * and must not be mutated through the getters.
 */
public final class Transition {
    private final INDArray state;
    private final INDArray action;
    private final double reward;
    private final INDArray nextState;
    private final boolean done;

    public Transition(INDArray state, INDArray action, double reward, INDArray nextState, boolean done) {
        if(state == null || action == null || nextState == null)
            throw new IllegalArgumentException("state, action and nextState are required");
        this.state = state.dup();
        this.action = action.dup();
        this.reward = reward;
        this.nextState = nextState.dup();
        this.done = done;
    }

    public INDArray getState() {
        return state;
    }

    public INDArray getAction() {
        return action;
    }

    public double getReward() {
        return reward;
    }

    public INDArray getNextState() {
        return nextState;
    }

    public boolean isDone() {
        return done;
    }

    @Override
    public String toString() {
        return "Transition{" + "state=" + state + ", action=" + action + ", reward=" + reward + ", nextState=" + nextState + ", done=" + done + '}';
    }
}
