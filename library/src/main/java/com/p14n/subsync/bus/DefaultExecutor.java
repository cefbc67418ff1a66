package com.p14n.subsync.bus;

import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a fixed-size pool
 * of named daemon threads.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        /**
         * Creates a new executor with a fixed-size thread pool.
         *
         * @param size the number of threads in the pool
         */
        public DefaultExecutor(int size) {
                this.es = createFixedExecutorService(size);
        }

        /**
         * Creates a fixed-size thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a fixed thread pool executor service
         */
        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder()
                                                .setNameFormat("subsync-dispatch-%d")
                                                .setDaemon(true)
                                                .build());
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
