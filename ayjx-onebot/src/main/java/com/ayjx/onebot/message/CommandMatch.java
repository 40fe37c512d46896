package com.ayjx.onebot.message;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.List;

/**
 * Result of a successful {@link CommandMatcher#match}.
 *
 * @param args    segments after the command name; the first one is the
 *                rest of the command's text segment, left-trimmed, when
 *                non-empty
 * @param replyId id of the message quoted in front of the command, or null
 * @param atIds   users mentioned in front of the command
 */
public record CommandMatch(ArrayNode args, String replyId, List<String> atIds) {

    /** Text of the arguments, trimmed. */
    public String argsText() {
        return Message.plainText(args).trim();
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }
}
