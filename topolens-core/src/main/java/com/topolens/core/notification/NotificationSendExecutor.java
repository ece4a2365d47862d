package com.topolens.core.notification;

import com.topolens.core.config.TopolensProperties;
import com.topolens.core.model.ApplicationDeploymentStatus;
import com.topolens.core.model.Project;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs notifier calls on a dedicated pool so that each one is bounded by the send timeout and a
 * hung channel cannot stall the watcher.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationSendExecutor {

    private final TopolensProperties properties;

    private ThreadPoolExecutor executor;
    private final AtomicInteger threads = new AtomicInteger();

    @PostConstruct
    public void start() {
        int workers = Math.max(1, properties.getNotifications().getWorkers());
        executor = new ThreadPoolExecutor(
                workers, workers, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "topolens-notify-" + threads.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        log.info(
                "Notification executor started workers={}, sendTimeout={}",
                workers,
                properties.getNotifications().getSendTimeout());
    }

    @PreDestroy
    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** Sends {@code status} through {@code notifier}; {@code true} only when the call completed in time. */
    public boolean send(DeploymentNotifier notifier, Project project, ApplicationDeploymentStatus status) {
        Duration timeout = properties.getNotifications().getSendTimeout();
        Future<?> future = executor.submit(() -> {
            notifier.send(project, status);
            return null;
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.error("[{}] {} notification timed out after {}", project.id(), notifier.channel(), timeout);
        } catch (ExecutionException ex) {
            log.error("[{}] {} notification failed", project.id(), notifier.channel(), ex.getCause());
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted while sending {} notification", project.id(), notifier.channel());
        }
        return false;
    }

    int largestPoolSize() {
        return executor.getLargestPoolSize();
    }
}
