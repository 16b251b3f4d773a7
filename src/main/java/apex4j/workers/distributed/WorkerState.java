package apex4j.workers.distributed;

/**
 * Mutable bookkeeping of one worker: identity, lifecycle phase and counters.
 * Written by the worker thread only; readable from any thread.
 */
public class WorkerState {

    public enum Phase {
        IDLE,
        COLLECTING,
        EMITTING
    }

    private final int rank;
    private final String device;
    private volatile Phase phase;
    private volatile long cycles;
    private volatile long episodes;
    private volatile long steps;
    private volatile long synchronizations;

    public WorkerState(int rank, String device) {
        this.rank = rank;
        this.device = device;
        this.phase = Phase.IDLE;
    }

    public int getRank() {
        return rank;
    }

    public String getDevice() {
        return device;
    }

    public Phase getPhase() {
        return phase;
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    public long getCycles() {
        return cycles;
    }

    void cycleFinished() {
        cycles++;
    }

    public long getEpisodes() {
        return episodes;
    }

    public long getSteps() {
        return steps;
    }

    void episodeFinished(int episodeSteps) {
        episodes++;
        steps += episodeSteps;
    }

    public long getSynchronizations() {
        return synchronizations;
    }

    void parametersSynchronized() {
        synchronizations++;
    }

    @Override
    public String toString() {
        return "WorkerState{" + "rank=" + rank + ", device=" + device + ", phase=" + phase + ", cycles=" + cycles + ", episodes=" + episodes + ", steps=" + steps + '}';
    }
}
