package apex4j.workers.memory;

import java.util.ArrayList;
import java.util.List;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Worker-local experience buffer kept as parallel field sequences. Every field
 * grows by exactly one entry per accepted transition.
 */
public class LocalBuffer {
    private final List<INDArray> states;
    private final List<INDArray> actions;
    private final List<Double> rewards;
    private final List<INDArray> nextStates;
    private final List<Boolean> dones;

    public LocalBuffer() {
        this(16);
    }

    public LocalBuffer(int initialCapacity) {
        this.states = new ArrayList<>(initialCapacity);
        this.actions = new ArrayList<>(initialCapacity);
        this.rewards = new ArrayList<>(initialCapacity);
        this.nextStates = new ArrayList<>(initialCapacity);
        this.dones = new ArrayList<>(initialCapacity);
    }

    public void add(Transition t){
        states.add(t.getState());
        actions.add(t.getAction());
        rewards.add(t.getReward());
        nextStates.add(t.getNextState());
        dones.add(t.isDone());
        checkLockStep();
    }

    /**
     * Number of entries, measured on the states field.
     */
    public int size(){
        return states.size();
    }

    public boolean isEmpty(){
        return states.isEmpty();
    }

    public boolean isLockStep(){
        int n = states.size();
        return actions.size() == n && rewards.size() == n && nextStates.size() == n && dones.size() == n;
    }

    public void clear(){
        states.clear();
        actions.clear();
        rewards.clear();
        nextStates.clear();
        dones.clear();
    }

    public Transition get(int i){
        return new Transition(states.get(i), actions.get(i), rewards.get(i), nextStates.get(i), dones.get(i));
    }

    /**
     * Freeze the buffer content into fixed size arrays.
     */
    public TransitionBatch freeze(){
        checkLockStep();
        if(isEmpty())
            throw new IllegalStateException("Cannot freeze an empty local buffer");
        int n = size();
        double[] r = new double[n];
        double[] d = new double[n];
        for(int i=0;i<n;i++){
            r[i] = rewards.get(i);
            d[i] = dones.get(i) ? 1D : 0D;
        }
        return new TransitionBatch(
                TransitionBatch.stack(states),
                TransitionBatch.stack(actions),
                r,
                TransitionBatch.stack(nextStates),
                d);
    }

    private void checkLockStep(){
        if(!isLockStep())
            throw new IllegalStateException(String.format(
                    "Local buffer fields out of lock-step: states=%d, actions=%d, rewards=%d, nextStates=%d, dones=%d",
                    states.size(), actions.size(), rewards.size(), nextStates.size(), dones.size()));
    }
}
