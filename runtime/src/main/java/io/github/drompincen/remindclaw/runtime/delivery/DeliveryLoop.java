package io.github.drompincen.remindclaw.runtime.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single-threaded loop that owns the chat transport. Other threads never call the transport
 * directly; they {@link #submit(Runnable)} work onto the loop's channel and the loop runs it
 * on its own turn, one task at a time.
 *
 * <p>Each {@link #start()} after a {@link #stop()} runs a fresh worker with its own channel, so
 * a worker that is still winding down never affects its successor.
 */
public class DeliveryLoop {

    private static final Logger log = LoggerFactory.getLogger(DeliveryLoop.class);
    private static final Runnable NOTHING = () -> {};

    private final String threadName;
    private volatile Worker worker;

    private record Pending(Runnable task, Runnable onDropped) {}

    public DeliveryLoop(String threadName) {
        this.threadName = threadName;
    }

    public synchronized void start() {
        Worker current = worker;
        if (current != null && current.active) return;
        Worker next = new Worker();
        worker = next;
        next.thread.start();
        log.info("Delivery loop {} started", threadName);
    }

    public synchronized void stop() {
        Worker current = worker;
        if (current == null || !current.active) return;
        current.active = false;
        current.thread.interrupt();
        log.info("Delivery loop {} stopping", threadName);
    }

    public boolean isRunning() {
        Worker current = worker;
        return current != null && current.active && current.thread.isAlive();
    }

    /** @return {@code false} when the loop is not running and the task was not accepted */
    public boolean submit(Runnable task) {
        return submit(task, NOTHING);
    }

    /**
     * Like {@link #submit(Runnable)}; {@code onDropped} runs instead of {@code task} if the loop
     * stops before reaching it.
     */
    public boolean submit(Runnable task, Runnable onDropped) {
        Worker current = worker;
        if (current == null || !current.active || !current.thread.isAlive()) return false;
        Pending pending = new Pending(task, onDropped);
        if (!current.channel.offer(pending)) return false;
        // stopped between the check and the offer: take it back unless the worker already drained it
        if (!current.active && current.channel.remove(pending)) return false;
        return true;
    }

    public boolean isLoopThread() {
        Worker current = worker;
        return current != null && Thread.currentThread() == current.thread;
    }

    public String threadName() {
        return threadName;
    }

    private final class Worker implements Runnable {

        private final BlockingQueue<Pending> channel = new LinkedBlockingQueue<>();
        private final Thread thread;
        private volatile boolean active = true;

        private Worker() {
            thread = new Thread(this, threadName);
            thread.setDaemon(true);
        }

        @Override
        public void run() {
            while (active) {
                Pending next;
                try {
                    next = channel.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                try {
                    next.task().run();
                } catch (Exception e) {
                    log.error("Delivery loop task failed", e);
                }
            }
            active = false;
            List<Pending> dropped = new ArrayList<>();
            channel.drainTo(dropped);
            if (dropped.isEmpty()) return;
            log.warn("Delivery loop {} stopped with {} pending task(s) dropped", threadName, dropped.size());
            for (Pending pending : dropped) {
                try {
                    pending.onDropped().run();
                } catch (Exception e) {
                    log.error("Dropped-task callback failed", e);
                }
            }
        }
    }
}
