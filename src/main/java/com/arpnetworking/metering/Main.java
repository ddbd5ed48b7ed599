/*
 * Copyright 2024 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.metering;

import ch.qos.logback.classic.LoggerContext;
import com.arpnetworking.metering.configuration.ConfigurationLoader;
import com.arpnetworking.metering.configuration.MeteringConfiguration;
import com.arpnetworking.metering.storage.Database;
import com.arpnetworking.metering.utility.Launchable;
import com.arpnetworking.steno.Logger;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Class containing entry point for the metering store service.
 *
 * @author Inscope Metrics
 */
public final class Main implements Launchable {
    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        Thread.setDefaultUncaughtExceptionHandler(
                (thread, throwable) -> {
                    LOGGER.error()
                            .setMessage("Unhandled exception!")
                            .setThrowable(throwable)
                            .log();
                });

        Thread.currentThread().setUncaughtExceptionHandler(
                (thread, throwable) -> {
                    LOGGER.error()
                            .setMessage("Unhandled exception!")
                            .setThrowable(throwable)
                            .log();
                }
        );

        LOGGER.info()
                .setMessage("Launching metering-store")
                .log();

        Runtime.getRuntime().addShutdownHook(SHUTDOWN_THREAD);

        if (args.length != 1) {
            throw new RuntimeException("No configuration file specified");
        }

        Optional<Main> main = Optional.empty();
        try {
            final MeteringConfiguration configuration = ConfigurationLoader.load(new File(args[0]));
            main = Optional.of(new Main(configuration));
            _shutdownTimeoutSeconds = configuration.getShutdownTimeout().getSeconds();

            // A failed schema upgrade propagates from here and exits the process
            main.get().launch();

            LOGGER.info()
                    .setMessage("Store launched, waiting for shutdown signal")
                    .log();
            SHUTDOWN_SEMAPHORE.acquire();
            LOGGER.info()
                    .setMessage("Shutdown signal received, shutting down main thread")
                    .log();
        } catch (final InterruptedException e) {
            throw new RuntimeException(e);
        } finally {
            if (main.isPresent()) {
                main.get().shutdown();
            } else {
                LOGGER.warn()
                        .setMessage("No store present to shut down")
                        .log();
            }
            // Notify the shutdown that we're done
            SHUTDOWN_SEMAPHORE.release();
        }
    }

    /**
     * Public constructor.
     *
     * @param configuration The configuration object.
     */
    public Main(final MeteringConfiguration configuration) {
        _configuration = configuration;
    }

    /**
     * Launch the component.
     */
    @Override
    public synchronized void launch() {
        final Injector injector = Guice.createInjector(new GuiceModule(_configuration));
        _database = injector.getInstance(Database.class);
        LOGGER.info()
                .setMessage("Launching database")
                .addData("database", _database)
                .log();
        _database.launch();
        _store = injector.getInstance(MeteringStore.class);
    }

    /**
     * Shutdown the component.
     */
    @Override
    public synchronized void shutdown() {
        if (_database != null) {
            LOGGER.info()
                    .setMessage("Stopping database")
                    .addData("database", _database)
                    .log();
            _database.shutdown();
        }
        _store = null;
    }

    /**
     * The store, available once launched.
     *
     * @return the store or empty if not launched
     */
    public synchronized Optional<MeteringStore> getStore() {
        return Optional.ofNullable(_store);
    }

    private final MeteringConfiguration _configuration;

    @Nullable
    private volatile Database _database;
    @Nullable
    private volatile MeteringStore _store;

    private static volatile long _shutdownTimeoutSeconds = 60;

    private static final Logger LOGGER = com.arpnetworking.steno.LoggerFactory.getLogger(Main.class);
    private static final Semaphore SHUTDOWN_SEMAPHORE = new Semaphore(0, true);
    private static final Thread SHUTDOWN_THREAD = new ShutdownThread();

    private static final class ShutdownThread extends Thread {
        private ShutdownThread() {
            super("MeteringStoreShutdownHook");
        }

        @Override
        public void run() {
            LOGGER.info()
                    .setMessage("Stopping metering-store")
                    .log();

            // release the main thread waiting for shutdown signal
            SHUTDOWN_SEMAPHORE.release();

            try {
                // wait for it to signal that it has completed shutdown
                if (!SHUTDOWN_SEMAPHORE.tryAcquire(_shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                    LOGGER.warn()
                            .setMessage("Shutdown did not complete in a timely manner")
                            .log();
                }
            } catch (final InterruptedException e) {
                throw new RuntimeException(e);
            } finally {
                LOGGER.info()
                        .setMessage("Shutdown complete")
                        .log();
                final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
                context.stop();
            }
        }
    }
}
