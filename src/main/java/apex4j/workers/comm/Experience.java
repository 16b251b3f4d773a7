package apex4j.workers.comm;

import apex4j.workers.memory.TransitionBatch;

/**
 * Experience emitted by a worker at the end of a collection cycle: the frozen
 * local buffer and one priority per entry, in buffer order.
 */
public class Experience {
    private final int rank;
    private final long cycle;
    private final TransitionBatch batch;
    private final double[] priorities;

    public Experience(int rank, long cycle, TransitionBatch batch, double[] priorities) {
        if(priorities.length != batch.size())
            throw new IllegalArgumentException(String.format(
                    "Got %d priorities for a batch of %d transitions", priorities.length, batch.size()));
        this.rank = rank;
        this.cycle = cycle;
        this.batch = batch;
        this.priorities = priorities.clone();
    }

    public int getRank() {
        return rank;
    }

    public long getCycle() {
        return cycle;
    }

    public TransitionBatch getBatch() {
        return batch;
    }

    public double[] getPriorities() {
        return priorities.clone();
    }

    public int size(){
        return batch.size();
    }

    @Override
    public String toString() {
        return "Experience{" + "rank=" + rank + ", cycle=" + cycle + ", size=" + batch.size() + '}';
    }
}
