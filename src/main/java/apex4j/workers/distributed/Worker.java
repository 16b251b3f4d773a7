package apex4j.workers.distributed;

import apex4j.workers.env.Environment;
import apex4j.workers.env.EnvironmentFactory;
import apex4j.workers.env.StepResult;
import apex4j.workers.memory.TransitionBatch;
import apex4j.workers.network.PolicyNetwork;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.api.rng.Random;
import org.nd4j.linalg.factory.Nd4j;

/**
 * Base class of distributed experience collection workers.
 * <p>
 * A worker cycles Idle -> Collecting -> Emitting -> Idle: it fills a local buffer
 * from its own environment, scores the buffer for prioritized replay, hands it to
 * the learner and starts over. Parameter updates from the learner are applied at
 * safe points chosen by the worker, never in the middle of an action selection.
 * <p>
 * Seeding is derived from the rank: the worker generator is seeded with the rank
 * and its first draw, in [0, 1000), seeds the environment and its action space.
 * Subclass constructors must call {@link #initNetworks()} and
 * {@link #initCommunication()} once their own fields are set.
 */
public abstract class Worker implements EnvironmentDriver, PolicySource {
    protected final WorkerConfig config;
    protected final WorkerState state;
    protected final Environment env;
    protected final Random rnd;
    protected final long envSeed;
    protected final EpisodeStatistics statistics;
    protected final Logger logger;
    private volatile boolean stopRequested;

    public Worker(int rank, WorkerConfig config, EnvironmentFactory envFactory) {
        if(rank < 0)
            throw new IllegalArgumentException("Worker rank must be >= 0, got " + rank);
        this.config = config;
        this.state = new WorkerState(rank, config.getDevice());
        this.statistics = new EpisodeStatistics();
        this.logger = Logger.getLogger(getClass().getName());
        this.env = envFactory.createInstance();
        this.rnd = Nd4j.getRandomFactory().getNewRandomInstance(rank);
        this.envSeed = rnd.nextInt(1000);
        this.env.seed(envSeed);
        this.env.getActionSpace().seed(envSeed);
        this.stopRequested = false;
    }

    protected abstract void initNetworks();

    protected abstract void initCommunication();

    @Override
    public abstract INDArray selectAction(INDArray state);

    @Override
    public abstract StepResult step(INDArray action);

    /**
     * Run one collection cycle and return the frozen local buffer, or null if the
     * worker was stopped before the buffer filled up.
     */
    public abstract TransitionBatch collectData();

    @Override
    public abstract void synchronize(List<INDArray> newParams);

    /**
     * Perpetual collect -> prioritize -> emit loop. Returns once {@link #stop()} was
     * called; a partially filled buffer is dropped.
     * @throws InterruptedException if interrupted while blocked on emission
     */
    public abstract void run() throws InterruptedException;

    /**
     * Copy parameters received from the learner into a network, in place.
     */
    protected void synchronize(PolicyNetwork network, List<INDArray> newParams){
        ParameterSynchronizer.synchronize(network, newParams);
        state.parametersSynchronized();
        logger.log(Level.FINE, "Worker {0} synchronized {1} parameter arrays", new Object[]{getRank(), newParams.size()});
    }

    protected static INDArray preprocessState(INDArray state){
        return state.castTo(DataType.FLOAT);
    }

    protected void beginCollecting(){
        state.setPhase(WorkerState.Phase.COLLECTING);
    }

    protected void beginEmitting(){
        state.setPhase(WorkerState.Phase.EMITTING);
    }

    protected void becomeIdle(){
        state.setPhase(WorkerState.Phase.IDLE);
    }

    protected void cycleFinished(){
        state.cycleFinished();
    }

    /**
     * Record an episode and log its summary.
     * @param truncated true if the episode was cut because the local buffer was full
     */
    protected void episodeFinished(double score, int steps, double epsilon, boolean truncated){
        state.episodeFinished(steps);
        statistics.addResult(score, steps);
        logger.log(config.isDebug() ? Level.INFO : Level.FINE,
                "worker {0} episode {1} {2}. Score: {3}. Steps: {4}. Epsilon: {5}. Avg-Score: {6}",
                new Object[]{getRank(), state.getEpisodes(), truncated ? "truncated" : "terminated",
                    score, steps, epsilon, statistics.getLastAverageReward()});
    }

    /**
     * Ask the run loop to terminate at the next state change.
     */
    public void stop(){
        stopRequested = true;
    }

    public boolean isStopRequested(){
        return stopRequested || Thread.currentThread().isInterrupted();
    }

    public int getRank() {
        return state.getRank();
    }

    public WorkerState getState() {
        return state;
    }

    public WorkerConfig getConfig() {
        return config;
    }

    public long getEnvSeed() {
        return envSeed;
    }

    public Environment getEnvironment() {
        return env;
    }

    public EpisodeStatistics getStatistics() {
        return statistics;
    }
}
