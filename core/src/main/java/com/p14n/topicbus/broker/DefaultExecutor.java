package com.p14n.topicbus.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a thread pool.
 * Threads are named and run as daemons so pending handlers never keep the JVM
 * alive.
 *
 * <p>
 * The no-argument constructor uses a cached pool that grows with demand; the
 * sized constructor caps concurrency with a fixed pool.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        /**
         * Creates a new executor with a cached thread pool.
         */
        public DefaultExecutor() {
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a new executor with a fixed-size thread pool.
         *
         * @param fixedSize the size of the fixed thread pool
         */
        public DefaultExecutor(int fixedSize) {
                this.es = createFixedExecutorService(fixedSize);
        }

        /**
         * Creates a fixed-size thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a fixed thread pool executor service
         */
        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("topic-bus-fixed-%d").setDaemon(true).build());
        }

        /**
         * Creates a cached thread pool with named threads.
         *
         * @return a cached thread pool executor service
         */
        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("topic-bus-async-%d").setDaemon(true).build());
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
