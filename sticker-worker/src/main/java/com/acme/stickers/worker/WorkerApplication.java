package com.acme.stickers.worker;

import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker process. Waits for PostgreSQL and Redis, then drains the submission queue until the JVM
 * is asked to stop. Several instances may run against the same queue.
 */
public class WorkerApplication {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerApplication.class);

    public static void main(String[] args) {
        LOG.info("Starting DB Worker...");
        ApplicationContext context = Micronaut.run(WorkerApplication.class, args);
        // No embedded server keeps the context alive, so SIGTERM has to close it for @PreDestroy to run.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> closeIfRunning(context), "shutdown"));

        StartupDependencyCheck check = context.getBean(StartupDependencyCheck.class);
        if (!check.awaitDependencies()) {
            LOG.error("Required dependencies are not available. Exiting.");
            context.close();
            System.exit(1);
        }

        context.getBean(SubmissionConsumer.class).start();
    }

    private static void closeIfRunning(ApplicationContext context) {
        if (context.isRunning()) {
            LOG.info("Shutting down...");
            context.close();
        }
    }
}
