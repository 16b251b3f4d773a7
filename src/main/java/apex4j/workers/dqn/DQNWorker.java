package apex4j.workers.dqn;

import apex4j.workers.comm.Experience;
import apex4j.workers.comm.LocalLearnerChannel;
import apex4j.workers.comm.WorkerChannel;
import apex4j.workers.distributed.PrioritySource;
import apex4j.workers.distributed.Worker;
import apex4j.workers.distributed.WorkerConfig;
import apex4j.workers.env.EnvironmentFactory;
import apex4j.workers.env.StepResult;
import apex4j.workers.loss.LossFactory;
import apex4j.workers.loss.LossFunction;
import apex4j.workers.memory.LocalBuffer;
import apex4j.workers.memory.NStepWindow;
import apex4j.workers.memory.Transition;
import apex4j.workers.memory.TransitionBatch;
import apex4j.workers.network.HeadConfig;
import apex4j.workers.network.QNetwork;
import apex4j.workers.policy.EpsilonGreedy;
import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Ape-X DQN worker (http://arxiv.org/abs/1803.00933).
 * <p>
 * Collects epsilon-greedy experience, optionally folded into n-step transitions,
 * until the local buffer holds exactly LOCAL_BUFFER_MAX_SIZE entries. The episode in
 * flight when the buffer fills is cut at that point. The n-step window slides
 * across episode boundaries and is only cleared when a new cycle starts.
 * Initial priorities are the element-wise loss of the current network plus PER_EPS.
 */
public class DQNWorker extends Worker implements PrioritySource {
    private final HeadConfig head;
    private final LossFunction lossFn;
    private final List<INDArray> initialParams;
    private final LocalLearnerChannel learner;
    private final LocalBuffer localBuffer;
    private final NStepWindow nStepWindow;

    private QNetwork dqn;
    private EpsilonGreedy policy;
    private WorkerChannel channel;

    /**
     * @param initialParams parameters loaded into the network at start, in enumeration
     *                      order; null keeps the rank-seeded initialisation
     * @param learner channel to the learner, null for a worker that is only driven
     *                through {@link #collectData()}. The worker disconnects when
     *                {@link #run()} returns or fails.
     */
    public DQNWorker(
            int rank,
            WorkerConfig config,
            EnvironmentFactory envFactory,
            List<INDArray> initialParams,
            LocalLearnerChannel learner) {
        super(rank, config, envFactory);
        this.head = new HeadConfig(env.getObservationSize(), env.getActionSpace().size(), config.getHiddenSize());
        this.lossFn = LossFactory.build(config.getLossType());
        this.initialParams = initialParams;
        this.learner = learner;
        this.localBuffer = new LocalBuffer(config.getLocalBufferMaxSize());
        this.nStepWindow = config.useNStep() ? new NStepWindow(config.getNStep(), config.getDiscountFactor()) : null;

        initNetworks();
        initCommunication();
    }

    @Override
    protected void initNetworks() {
        dqn = new QNetwork(head, getRank());
        if(initialParams != null)
            synchronize(dqn, initialParams);
        policy = new EpsilonGreedy(
                config.getMaxEpsilon(),
                config.getMinEpsilon(),
                config.getEpsilonDecay(),
                rnd,
                env.getActionSpace(),
                dqn);
    }

    @Override
    protected void initCommunication() {
        if(learner != null)
            channel = learner.connect(getRank());
    }

    /**
     * Load network parameters saved with {@link QNetwork#saveModel(String)}.
     */
    public synchronized void loadParams(String path) throws IOException {
        dqn.loadModel(path);
        logger.log(Level.INFO, "worker {0} loaded the model from {1}", new Object[]{getRank(), path});
    }

    @Override
    public synchronized INDArray selectAction(INDArray state) {
        return policy.chooseAction(preprocessState(state));
    }

    @Override
    public StepResult step(INDArray action) {
        return env.step(action);
    }

    @Override
    public synchronized double[] computePriorities(TransitionBatch batch) {
        INDArray lossElementWise = lossFn.elementWise(dqn, dqn, batch, config.getDiscountFactor(), head);
        double[] priorities = lossElementWise.reshape(lossElementWise.length()).toDoubleVector();
        for(int i=0;i<priorities.length;i++)
            priorities[i] += config.getPerEps();
        return priorities;
    }

    /**
     * Fill the local buffer up to LOCAL_BUFFER_MAX_SIZE entries.
     * @return the frozen buffer, or null if the worker was stopped before it filled
     */
    @Override
    public TransitionBatch collectData() {
        beginCollecting();
        localBuffer.clear();
        if(nStepWindow != null)
            nStepWindow.clear();
        int maxSize = config.getLocalBufferMaxSize();

        while(localBuffer.size() < maxSize && !isStopRequested()){
            pollParameters();
            INDArray observation = env.reset();
            boolean done = false;
            double score = 0D;
            int numSteps = 0;
            while(!done && localBuffer.size() < maxSize && !isStopRequested()){
                numSteps++;
                INDArray action = selectAction(observation);
                StepResult result = step(action);
                Transition transition = new Transition(observation, action, result.getReward(), result.getNextState(), result.isDone());
                if(nStepWindow != null){
                    Transition nStepTransition = nStepWindow.add(transition);
                    if(nStepTransition != null)
                        localBuffer.add(nStepTransition);
                }else{
                    localBuffer.add(transition);
                }
                observation = result.getNextState();
                score += result.getReward();
                done = result.isDone();
            }
            episodeFinished(score, numSteps, policy.getEpsilon(), !done);
        }
        if(localBuffer.size() < maxSize)
            return null;
        return localBuffer.freeze();
    }

    @Override
    public synchronized void synchronize(List<INDArray> newParams) {
        synchronize(dqn, newParams);
    }

    @Override
    public void run() throws InterruptedException {
        if(channel == null)
            throw new IllegalStateException("worker " + getRank() + " has no learner channel");
        logger.log(Level.INFO, "worker {0} started on {1}, env seed {2}", new Object[]{getRank(), state.getDevice(), envSeed});
        try {
            while(!isStopRequested()){
                becomeIdle();
                pollParameters();
                TransitionBatch batch = collectData();
                if(batch == null || isStopRequested())
                    break;
                beginEmitting();
                double[] priorities = computePriorities(batch);
                channel.emit(new Experience(getRank(), state.getCycles(), batch, priorities));
                cycleFinished();
            }
        } finally {
            becomeIdle();
            learner.disconnect(getRank());
            logger.log(Level.INFO, "worker {0} stopped after {1} cycles", new Object[]{getRank(), state.getCycles()});
        }
    }

    private void pollParameters(){
        if(channel == null)
            return;
        List<INDArray> newParams = channel.pollParameters();
        if(newParams != null)
            synchronize(newParams);
    }

    @Override
    public QNetwork getPolicyNetwork() {
        return dqn;
    }

    public HeadConfig getHead() {
        return head;
    }

    public double getEpsilon() {
        return policy.getEpsilon();
    }

    LocalBuffer getLocalBuffer() {
        return localBuffer;
    }
}
