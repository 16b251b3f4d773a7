package apex4j.workers.memory;

import java.util.List;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Frozen, fixed size view over a set of transitions. Row i of every field
 * belongs to the same transition.
 */
public class TransitionBatch {
    private final INDArray states;
    private final INDArray actions;
    private final double[] rewards;
    private final INDArray nextStates;
    private final double[] dones;

    public TransitionBatch(INDArray states, INDArray actions, double[] rewards, INDArray nextStates, double[] dones) {
        int n = rewards.length;
        if(states.rows() != n || actions.rows() != n || nextStates.rows() != n || dones.length != n)
            throw new IllegalArgumentException(String.format(
                    "Batch fields differ in length: states=%d, actions=%d, rewards=%d, nextStates=%d, dones=%d",
                    states.rows(), actions.rows(), n, nextStates.rows(), dones.length));
        this.states = states;
        this.actions = actions;
        this.rewards = rewards.clone();
        this.nextStates = nextStates;
        this.dones = dones.clone();
    }

    public TransitionBatch(List<Transition> transitions) {
        this(transitionsToBuffer(transitions));
    }

    private TransitionBatch(TransitionBatch other) {
        this(other.states, other.actions, other.rewards, other.nextStates, other.dones);
    }

    private static TransitionBatch transitionsToBuffer(List<Transition> transitions){
        LocalBuffer buffer = new LocalBuffer(transitions.size());
        for(Transition t : transitions)
            buffer.add(t);
        return buffer.freeze();
    }

    /**
     * Stack row vectors into a matrix [n, dim] of the first row's data type.
     */
    static INDArray stack(List<INDArray> rows){
        int n = rows.size();
        DataType dataType = rows.get(0).dataType();
        INDArray[] data = new INDArray[n];
        for(int i=0;i<n;i++){
            INDArray row = rows.get(i);
            data[i] = row.castTo(dataType).reshape(1, row.length());
        }
        return Nd4j.vstack(data);
    }

    public int size(){
        return rewards.length;
    }

    public INDArray getStates() {
        return states;
    }

    public INDArray getActions() {
        return actions;
    }

    public double[] getRewards() {
        return rewards.clone();
    }

    public INDArray getNextStates() {
        return nextStates;
    }

    /**
     * @return 1.0 for terminal transitions, 0.0 otherwise
     */
    public double[] getDones() {
        return dones.clone();
    }

    public Transition get(int i){
        return new Transition(
                states.getRow(i),
                actions.getRow(i),
                rewards[i],
                nextStates.getRow(i),
                dones[i] != 0D);
    }
}
