package apex4j.workers.memory;

import apex4j.workers.utils.AgentUtils;

/**
 * Sliding window of the last N transitions, backed by a fixed size ring buffer.
 * Once the window is full every new transition evicts the oldest one and yields a
 * folded n-step transition. The window is not cleared after a fold, so consecutive
 * folds share N-1 transitions.
 */
public class NStepWindow {
    private final Transition[] slots;
    private final double discountFactor;
    private int head;
    private int count;

    public NStepWindow(int capacity, double discountFactor) {
        if(capacity < 1)
            throw new IllegalArgumentException("n-step window capacity must be >= 1, got " + capacity);
        this.slots = new Transition[capacity];
        this.discountFactor = discountFactor;
        this.head = 0;
        this.count = 0;
    }

    /**
     * Push a transition, evicting the oldest one if the window is full.
     * @param t
     * @return the folded n-step transition when the window is full, null otherwise
     */
    public Transition add(Transition t){
        if(count == slots.length){
            slots[head] = t;
            head = (head+1)%slots.length;
        }else{
            slots[(head+count)%slots.length] = t;
            count++;
        }
        return isFull() ? fold() : null;
    }

    /**
     * Fold the window: (s_0, a_0, sum gamma^i r_i, s'_{N-1}, OR done_i).
     */
    public Transition fold(){
        if(!isFull())
            throw new IllegalStateException("Cannot fold a window holding " + count + " of " + slots.length + " transitions");
        double[] rewards = new double[count];
        boolean done = false;
        for(int i=0;i<count;i++){
            Transition t = get(i);
            rewards[i] = t.getReward();
            done |= t.isDone();
        }
        Transition first = get(0);
        Transition last = get(count-1);
        return new Transition(
                first.getState(),
                first.getAction(),
                AgentUtils.discountedSum(rewards, discountFactor),
                last.getNextState(),
                done);
    }

    /**
     * Transition at position i, 0 being the oldest.
     */
    public Transition get(int i){
        if(i < 0 || i >= count)
            throw new IndexOutOfBoundsException("Index " + i + " out of window of size " + count);
        return slots[(head+i)%slots.length];
    }

    public boolean isFull(){
        return count == slots.length;
    }

    public int size(){
        return count;
    }

    public void clear(){
        for(int i=0;i<slots.length;i++)
            slots[i] = null;
        head = 0;
        count = 0;
    }
}
