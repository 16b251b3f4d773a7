package apex4j.workers.comm;

import apex4j.workers.env.DiscreteActionSpace;
import apex4j.workers.memory.LocalBuffer;
import apex4j.workers.memory.Transition;
import apex4j.workers.memory.TransitionBatch;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class LocalLearnerChannelTest {
    LocalLearnerChannel learner = new LocalLearnerChannel(1);

    private static TransitionBatch batch(){
        LocalBuffer buffer = new LocalBuffer();
        buffer.add(new Transition(Nd4j.create(new float[]{0F}), DiscreteActionSpace.action(0), 1D, Nd4j.create(new float[]{1F}), false));
        buffer.add(new Transition(Nd4j.create(new float[]{1F}), DiscreteActionSpace.action(1), 0D, Nd4j.create(new float[]{2F}), true));
        return buffer.freeze();
    }

    private static List<INDArray> params(float v){
        List<INDArray> params = new ArrayList<>();
        params.add(Nd4j.valueArrayOf(new long[]{2, 2}, (double) v));
        return params;
    }

    @Test
    void pollReturnsNullWithoutUpdates() {
        WorkerChannel channel = learner.connect(0);
        assertNull(channel.pollParameters());
    }

    @Test
    void latestUpdateWins() {
        WorkerChannel channel = learner.connect(0);
        learner.publish(params(1F));
        learner.publish(params(2F));
        learner.publish(params(3F));
        List<INDArray> received = channel.pollParameters();
        assertEquals(3F, received.get(0).getFloat(0, 0));
        assertNull(channel.pollParameters());
    }

    @Test
    void mailboxKeepsOnlyNewestSet() {
        WorkerChannel channel = learner.connect(0);
        for(int i=0;i<100;i++)
            learner.publish(params(i));
        assertEquals(1, learner.pendingParameters(0));
        assertEquals(99F, channel.pollParameters().get(0).getFloat(0, 0));
        assertEquals(0, learner.pendingParameters(0));
    }

    @Test
    void everyWorkerGetsItsOwnCopy() {
        WorkerChannel a = learner.connect(0);
        WorkerChannel b = learner.connect(1);
        List<INDArray> published = params(1F);
        learner.publish(published);
        published.get(0).assign(9F);

        INDArray pa = a.pollParameters().get(0);
        INDArray pb = b.pollParameters().get(0);
        assertEquals(1F, pa.getFloat(0, 0));
        assertNotSame(pa, pb);
        pa.assign(5F);
        assertEquals(1F, pb.getFloat(0, 0));
    }

    @Test
    void disconnectedWorkersReceiveNothing() {
        WorkerChannel channel = learner.connect(0);
        learner.disconnect(0);
        learner.publish(params(1F));
        assertNull(channel.pollParameters());
        assertEquals(0, learner.connectedWorkers());
    }

    @Test
    void duplicateRank() {
        learner.connect(3);
        assertThrows(IllegalStateException.class, () -> learner.connect(3));
    }

    @Test
    void emitBlocksWhileQueueIsFull() throws InterruptedException {
        WorkerChannel channel = learner.connect(0);
        channel.emit(new Experience(0, 0L, batch(), new double[]{1D, 1D}));
        Thread blocked = new Thread(() -> {
            try {
                channel.emit(new Experience(0, 1L, batch(), new double[]{1D, 1D}));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        blocked.start();
        blocked.join(300);
        assertTrue(blocked.isAlive());
        assertEquals(1, learner.pendingExperiences());

        assertEquals(0L, learner.take().getCycle());
        blocked.join(5000);
        assertFalse(blocked.isAlive());
        Experience second = learner.poll(1, TimeUnit.SECONDS);
        assertEquals(1L, second.getCycle());
        assertEquals(2, second.size());
    }

    @Test
    void experiencePrioritiesAreCopied() {
        double[] priorities = new double[]{1D, 2D};
        Experience e = new Experience(0, 0L, batch(), priorities);
        priorities[0] = 7D;
        e.getPriorities()[1] = 7D;
        assertArrayEquals(new double[]{1D, 2D}, e.getPriorities(), 0D);
    }

    @Test
    void experienceNeedsOnePriorityPerTransition() {
        assertThrows(IllegalArgumentException.class, () -> new Experience(0, 0L, batch(), new double[]{1D}));
    }
}
