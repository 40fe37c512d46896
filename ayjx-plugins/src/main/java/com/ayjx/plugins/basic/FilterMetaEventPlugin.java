package com.ayjx.plugins.basic;

import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.pipeline.BotPlugin;

import java.util.Optional;

/**
 * Stops heartbeats and lifecycle notices ({@code post_type == "meta_event"})
 * before the rest of the chain sees them.
 */
public class FilterMetaEventPlugin implements BotPlugin {

    public static final String NAME = "filter_meta_event";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<BotContext> handle(BotContext ctx, FrameWriter writer) {
        if (ctx.postType().filter("meta_event"::equals).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(ctx);
    }
}
