package io.penguin.metrics.agent;

import io.penguin.metrics.agent.collector.Collector;
import io.penguin.metrics.agent.collector.CollectorResult;
import io.penguin.metrics.agent.collector.CollectorState;
import io.penguin.metrics.agent.collector.Origin;
import io.penguin.metrics.agent.homeassistant.Device;
import io.penguin.metrics.agent.homeassistant.Sensor;

import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A live collector together with its runtime bookkeeping: lifecycle state, schedule,
 * announced sensors and the last published result.
 */
public class ManagedCollector {

    private final Collector collector;
    private final Origin origin;
    private final Device device;
    private final List<Sensor> sensors;
    private final String stateTopic;

    private volatile CollectorState state = CollectorState.CREATED;
    private volatile CollectorResult lastResult;
    private volatile ScheduledFuture<?> schedule;
    private final ReentrantLock cycleLock = new ReentrantLock();

    public ManagedCollector(Collector collector, Origin origin, Device device, List<Sensor> sensors,
                            String stateTopic) {
        this.collector = collector;
        this.origin = origin;
        this.device = device;
        this.sensors = List.copyOf(sensors);
        this.stateTopic = stateTopic;
    }

    public String key() {
        return collector.key();
    }

    public Collector getCollector() {
        return collector;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * @return the device the sensors are grouped under, {@code null} for none
     */
    public Device getDevice() {
        return device;
    }

    public List<Sensor> getSensors() {
        return sensors;
    }

    public String getStateTopic() {
        return stateTopic;
    }

    public CollectorState getState() {
        return state;
    }

    void setState(CollectorState state) {
        this.state = state;
    }

    public CollectorResult getLastResult() {
        return lastResult;
    }

    void setLastResult(CollectorResult lastResult) {
        this.lastResult = lastResult;
    }

    void setSchedule(ScheduledFuture<?> schedule) {
        this.schedule = schedule;
    }

    /**
     * Held for the whole of one collection cycle, including its publish.
     */
    ReentrantLock cycleLock() {
        return cycleLock;
    }

    void cancel() {
        ScheduledFuture<?> current = schedule;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "ManagedCollector{" + key() + ", origin=" + origin + ", state=" + state + "}";
    }
}
