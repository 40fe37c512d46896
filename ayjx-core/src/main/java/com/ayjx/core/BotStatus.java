package com.ayjx.core;

/**
 * Identity of the account a connection is logged in as.
 */
public record BotStatus(String adapter, String platform, LoginUser loginUser) {

    public record LoginUser(String id, String name, String nick, String avatar) {

        public static LoginUser unknown() {
            return new LoginUser("", null, null, null);
        }
    }

    public static BotStatus unknown(String adapter, String platform) {
        return new BotStatus(adapter, platform, LoginUser.unknown());
    }

    public boolean isKnown() {
        return loginUser != null && !loginUser.id().isEmpty();
    }
}
