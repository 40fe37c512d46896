package com.ayjx.onebot.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reply payloads ({@code data}) of the OneBot actions used by the bot.
 */
public final class OneBotTypes {

    private OneBotTypes() {
    }

    public record LoginInfo(
            @JsonProperty("user_id") long userId,
            @JsonProperty("nickname") String nickname) {
    }

    public record GroupInfo(
            @JsonProperty("group_id") long groupId,
            @JsonProperty("group_name") String groupName,
            @JsonProperty("member_count") Integer memberCount,
            @JsonProperty("max_member_count") Integer maxMemberCount) {
    }

    public record MessageData(
            @JsonProperty("time") long time,
            @JsonProperty("message_type") String messageType,
            @JsonProperty("message_id") long messageId,
            @JsonProperty("real_id") long realId,
            @JsonProperty("sender") JsonNode sender,
            @JsonProperty("message") JsonNode message) {
    }

    public record ForwardMessageData(@JsonProperty("message") JsonNode message) {
    }

    public record GroupMemberInfo(
            @JsonProperty("group_id") long groupId,
            @JsonProperty("user_id") long userId,
            @JsonProperty("nickname") String nickname,
            @JsonProperty("card") String card,
            @JsonProperty("sex") String sex,
            @JsonProperty("age") int age,
            @JsonProperty("area") String area,
            @JsonProperty("join_time") long joinTime,
            @JsonProperty("last_sent_time") long lastSentTime,
            @JsonProperty("level") String level,
            @JsonProperty("role") String role,
            @JsonProperty("unfriendly") boolean unfriendly,
            @JsonProperty("title") String title,
            @JsonProperty("title_expire_time") long titleExpireTime,
            @JsonProperty("card_changeable") boolean cardChangeable) {

        /** Card when set, otherwise nickname. */
        public String displayName() {
            return card != null && !card.isEmpty() ? card : nickname;
        }
    }
}
