package com.ayjx.onebot.message;

import com.ayjx.core.BotContext;
import com.ayjx.core.event.MessageEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognises {@code <prefix><name>} commands in message chains.
 * <p>
 * Leading {@code reply} and {@code at} segments and blank text are skipped
 * (their ids are collected). The first non-blank text segment must start
 * with one of the configured prefixes followed by the command name; any
 * other leading segment type means no match.
 */
public final class CommandMatcher {

    private CommandMatcher() {
    }

    public static Optional<CommandMatch> match(BotContext ctx, String name) {
        Optional<MessageEvent> message = ctx.asMessage();
        if (message.isEmpty()) {
            return Optional.empty();
        }
        JsonNode chain = message.get().segments();
        return match(chain, ctx.getConfig().commandPrefixes(), name);
    }

    public static Optional<CommandMatch> match(JsonNode chain, List<String> prefixes, String name) {
        if (chain == null || !chain.isArray()) {
            return Optional.empty();
        }
        String replyId = null;
        List<String> atIds = new ArrayList<>();

        for (int i = 0; i < chain.size(); i++) {
            JsonNode segment = chain.get(i);
            JsonNode type = segment.get("type");
            JsonNode data = segment.get("data");
            if (type == null || data == null) {
                return Optional.empty();
            }
            switch (type.asText()) {
                case "reply":
                    if (replyId == null) {
                        replyId = idText(data.get("id"));
                    }
                    break;
                case "at":
                    String qq = idText(data.get("qq"));
                    if (qq != null) {
                        atIds.add(qq);
                    }
                    break;
                case "text":
                    String text = data.path("text").asText("").stripLeading();
                    if (text.isEmpty()) {
                        break;
                    }
                    for (String prefix : prefixes) {
                        String target = prefix + name;
                        if (text.startsWith(target)) {
                            return Optional.of(new CommandMatch(
                                    argsAfter(chain, i, text.substring(target.length()).stripLeading()),
                                    replyId, atIds));
                        }
                    }
                    return Optional.empty();
                default:
                    return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static ArrayNode argsAfter(JsonNode chain, int index, String restOfText) {
        ArrayNode args = ((ArrayNode) chain).arrayNode();
        if (!restOfText.isEmpty()) {
            ObjectNode first = chain.get(index).deepCopy();
            ((ObjectNode) first.get("data")).put("text", restOfText);
            args.add(first);
        }
        for (int j = index + 1; j < chain.size(); j++) {
            args.add(chain.get(j).deepCopy());
        }
        return args;
    }

    private static String idText(JsonNode id) {
        if (id == null || id.isNull()) {
            return null;
        }
        return id.asText();
    }
}
