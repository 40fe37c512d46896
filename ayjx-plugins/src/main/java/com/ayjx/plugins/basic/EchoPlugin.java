package com.ayjx.plugins.basic;

import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.event.MessageEvent;
import com.ayjx.core.pipeline.BotPlugin;
import com.ayjx.onebot.api.OneBotApi;
import com.ayjx.onebot.message.CommandMatch;
import com.ayjx.onebot.message.CommandMatcher;

import java.util.Optional;

/**
 * {@code /echo <anything>} sends the arguments back to the same chat.
 * Without arguments the message is left for other plugins.
 */
public class EchoPlugin implements BotPlugin {

    public static final String NAME = "echo";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) throws Exception {
        Optional<CommandMatch> command = CommandMatcher.match(ctx, "echo");
        if (command.isEmpty() || !command.get().hasArgs()) {
            return Optional.of(ctx);
        }
        MessageEvent msg = ctx.asMessage().orElseThrow();
        OneBotApi.sendMsg(ctx, writer, msg.groupId(), msg.userId(), command.get().args());
        return Optional.empty();
    }
}
