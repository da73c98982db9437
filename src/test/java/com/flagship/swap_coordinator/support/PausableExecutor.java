package com.flagship.swap_coordinator.support;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * Runs tasks on the calling thread until paused; while paused, tasks queue
 * up until the test drains them. Lets a test line up several mailbox tasks
 * before any of them runs.
 */
public class PausableExecutor implements Executor {

    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private volatile boolean paused;

    @Override
    public void execute(Runnable task) {
        if (paused) {
            queue.add(task);
        } else {
            task.run();
        }
    }

    public void pause() {
        paused = true;
    }

    /**
     * Runs everything queued, including what the queued tasks submit.
     */
    public void drain() {
        Runnable next;
        while ((next = queue.poll()) != null) {
            next.run();
        }
    }

    public void resume() {
        paused = false;
        drain();
    }

    public int queued() {
        return queue.size();
    }
}
