package com.ayjx.plugins.basic;

import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.pipeline.BotPlugin;
import com.ayjx.onebot.api.OneBotApi;
import com.ayjx.onebot.message.CommandMatch;
import com.ayjx.onebot.message.CommandMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Replying to a message with {@code /撤回} deletes the quoted message and the
 * command itself.
 */
@Slf4j
public class RecallPlugin implements BotPlugin {

    public static final String NAME = "recall";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) throws Exception {
        Optional<CommandMatch> command = CommandMatcher.match(ctx, "撤回");
        if (command.isEmpty() || command.get().replyId() == null) {
            return Optional.of(ctx);
        }
        long target;
        try {
            target = Long.parseLong(command.get().replyId().trim());
        } catch (NumberFormatException e) {
            log.debug("[recall] ignoring non-numeric reply id {}", command.get().replyId());
            return Optional.of(ctx);
        }
        long commandId = ctx.asMessage().orElseThrow().messageId();
        OneBotApi.deleteMsg(writer, target);
        OneBotApi.deleteMsg(writer, commandId);
        log.info("[recall] deleted message {}", target);
        return Optional.empty();
    }
}
