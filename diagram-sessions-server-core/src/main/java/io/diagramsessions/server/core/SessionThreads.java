package io.diagramsessions.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Executor the engine creates for its session actors when none is configured. Each task gets a
 * thread named {@code diagram-sessions-N}: a virtual thread on runtimes that have them, a pooled
 * daemon thread otherwise. The engine owns the executor and shuts it down in
 * {@link DiagramSessionsEngine#shutdown()}.
 */
final class SessionThreads {

    static final String NAME_PREFIX = "diagram-sessions-";

    private static final Logger log = LoggerFactory.getLogger(SessionThreads.class);

    private SessionThreads() {
    }

    static ExecutorService create() {
        try {
            Object builder = Thread.class.getMethod("ofVirtual").invoke(null);
            Class<?> builderType = Class.forName("java.lang.Thread$Builder");
            builderType.getMethod("name", String.class, long.class).invoke(builder, NAME_PREFIX, 1L);
            ThreadFactory factory = (ThreadFactory) builderType.getMethod("factory").invoke(builder);
            Method perTask = Executors.class.getMethod("newThreadPerTaskExecutor", ThreadFactory.class);
            log.debug("session actors run on virtual threads");
            return (ExecutorService) perTask.invoke(null, factory);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("virtual threads unavailable ({}), session actors run on a daemon pool", e.toString());
            return Executors.newCachedThreadPool(new DaemonFactory());
        }
    }

    private static final class DaemonFactory implements ThreadFactory {
        private final AtomicLong next = new AtomicLong(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, NAME_PREFIX + next.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
