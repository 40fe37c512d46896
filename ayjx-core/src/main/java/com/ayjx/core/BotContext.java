package com.ayjx.core;

import com.ayjx.common.config.SharedConfig;
import com.ayjx.core.correlate.Correlator;
import com.ayjx.core.correlate.WaitCondition;
import com.ayjx.core.event.BotEvent;
import com.ayjx.core.event.MessageEvent;
import com.ayjx.core.event.OneBotEvent;
import com.ayjx.core.event.SendPacket;
import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.core.schedule.TaskScheduler;
import lombok.Builder;
import lombok.Getter;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Optional;

/**
 * Everything a plugin handler can reach: the event being processed plus the
 * shared services. Immutable; plugins that want to change the event build a
 * new context with {@link #withEvent(BotEvent)}.
 */
@Getter
@Builder(toBuilder = true)
public class BotContext {

    private final BotEvent event;
    private final SharedConfig config;
    private final TaskScheduler scheduler;
    private final Correlator correlator;
    private final PluginPipeline pipeline;
    /** Optional relational store for plugins that persist data; may be null. */
    private final DataSource dataSource;
    @Builder.Default
    private final BotStatus bot = BotStatus.unknown("onebot", "qq");

    public BotContext withEvent(BotEvent newEvent) {
        return toBuilder().event(newEvent).build();
    }

    public BotContext withBot(BotStatus status) {
        return toBuilder().bot(status).build();
    }

    public Optional<OneBotEvent> oneBotEvent() {
        return event instanceof OneBotEvent e ? Optional.of(e) : Optional.empty();
    }

    public Optional<SendPacket> sendPacket() {
        return event instanceof SendPacket p ? Optional.of(p) : Optional.empty();
    }

    public Optional<String> postType() {
        return oneBotEvent().flatMap(OneBotEvent::postType);
    }

    public Optional<MessageEvent> asMessage() {
        return oneBotEvent().flatMap(OneBotEvent::asMessage);
    }

    /**
     * Block until the next event from the given group and/or user, for
     * interactive prompts.
     *
     * @param groupId null for any group
     * @param userId  null for any user
     * @return the event, or empty when the timeout elapsed
     */
    public Optional<OneBotEvent> waitInput(Long groupId, Long userId, Duration timeout) throws InterruptedException {
        return correlator.await(new WaitCondition.ForSubject(groupId, userId), timeout);
    }
}
