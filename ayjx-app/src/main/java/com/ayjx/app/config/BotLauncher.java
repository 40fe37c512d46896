package com.ayjx.app.config;

import com.ayjx.common.config.AyjxConfig;
import com.ayjx.common.config.SharedConfig;
import com.ayjx.core.BotContext;
import com.ayjx.core.correlate.Correlator;
import com.ayjx.core.event.StartupEvent;
import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.core.schedule.TaskScheduler;
import com.ayjx.onebot.connection.OneBotConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings the bot up once the context is ready: merges plugin defaults into
 * the config, runs every plugin's init hook, then opens one connection per
 * configured endpoint, each with a correlator the launcher owns. Stopping
 * closes the connections, then their correlators; the scheduler, browser
 * and pipeline beans are closed by the container afterwards.
 */
@Slf4j
public class BotLauncher implements SmartLifecycle {

    private final SharedConfig config;
    private final TaskScheduler scheduler;
    private final PluginPipeline pipeline;
    private final ConnectionFactory connectionFactory;
    private final List<OneBotConnection> connections = new ArrayList<>();
    private final List<Correlator> correlators = new ArrayList<>();
    private volatile boolean running;

    public BotLauncher(SharedConfig config, TaskScheduler scheduler, PluginPipeline pipeline) {
        this(config, scheduler, pipeline, OneBotConnection::new);
    }

    BotLauncher(SharedConfig config, TaskScheduler scheduler, PluginPipeline pipeline,
            ConnectionFactory connectionFactory) {
        this.config = config;
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.connectionFactory = connectionFactory;
    }

    /** Services every context starts from; connections add their own correlator and identity. */
    BotContext baseContext() {
        return BotContext.builder()
                .event(StartupEvent.INSTANCE)
                .config(config)
                .scheduler(scheduler)
                .pipeline(pipeline)
                .build();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        config.ensurePluginDefaults(pipeline.defaultConfigs());
        BotContext base = baseContext();
        pipeline.runInit(base);

        List<AyjxConfig.BotEndpointConfig> endpoints = config.snapshot().getBots();
        for (AyjxConfig.BotEndpointConfig endpoint : endpoints) {
            Correlator correlator = new Correlator();
            correlators.add(correlator);
            OneBotConnection connection = connectionFactory.create(endpoint, base, correlator);
            connections.add(connection);
            connection.start();
            log.info("[app] connecting to {}", endpoint.getUrl());
        }
        if (endpoints.isEmpty()) {
            log.warn("[app] no bots configured; nothing to connect to");
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        for (OneBotConnection connection : connections) {
            connection.close();
        }
        connections.clear();
        for (Correlator correlator : correlators) {
            correlator.close();
        }
        correlators.clear();
        running = false;
        log.info("[app] all connections closed");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    List<OneBotConnection> getConnections() {
        return List.copyOf(connections);
    }

    @FunctionalInterface
    interface ConnectionFactory {
        OneBotConnection create(AyjxConfig.BotEndpointConfig endpoint, BotContext services, Correlator correlator);
    }
}
