package com.docclassifier.api.messaging;

import com.docclassifier.processing.ClassificationJobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process queue: runs jobs on the bounded classification worker pool.
 * A job id is queued at most once until its task has finished, so repeated publishing of a
 * still-PENDING job does not grow the queue.
 * Active when app.messaging.mode=executor (the default).
 */
@Service
@ConditionalOnProperty(name = "app.messaging.mode", havingValue = "executor", matchIfMissing = true)
public class ExecutorJobPublisher implements JobPublisher {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorJobPublisher.class);

    private final TaskExecutor executor;
    private final ClassificationJobWorker worker;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    public ExecutorJobPublisher(@Qualifier("classificationExecutor") TaskExecutor executor,
                                ClassificationJobWorker worker) {
        this.executor = executor;
        this.worker = worker;
    }

    @Override
    public boolean publishJobQueued(UUID jobId) {
        if (!inFlight.add(jobId)) {
            logger.debug("Job {} is already on the worker pool", jobId);
            return true;
        }
        Map<String, String> context = MDC.getCopyOfContextMap();
        try {
            executor.execute(() -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    worker.process(jobId);
                } finally {
                    inFlight.remove(jobId);
                    MDC.clear();
                }
            });
            logger.debug("Job {} handed to worker pool", jobId);
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(jobId);
            logger.warn("Worker pool saturated, job {} stays PENDING until the next poll", jobId);
            return false;
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }
}
