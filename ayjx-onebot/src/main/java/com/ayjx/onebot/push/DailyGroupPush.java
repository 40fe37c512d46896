package com.ayjx.onebot.push;

import com.ayjx.core.BotContext;
import com.ayjx.core.FrameWriter;
import com.ayjx.core.schedule.DailyAt;
import com.ayjx.onebot.api.OneBotApi;
import com.ayjx.onebot.api.OneBotApiException;
import com.ayjx.onebot.api.OneBotTypes;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * "Once a day, for every eligible group" broadcasts.
 * <p>
 * At the configured time the current group list is fetched, filtered
 * through the global allow/block lists, and the supplied task runs for each
 * remaining group with {@code push.groupDelayMs} between groups to stay
 * clear of platform rate limits.
 */
@Slf4j
public final class DailyGroupPush {

    /** Work done for one group. */
    @FunctionalInterface
    public interface GroupTask {
        void run(long groupId, BotContext ctx, FrameWriter writer) throws Exception;
    }

    private DailyGroupPush() {
    }

    /**
     * Register the daily broadcast with the context's scheduler.
     *
     * @param label  name used in log lines
     * @param hhmmss local time of day, {@code HH:MM:SS}
     * @return scheduler handle
     * @throws IllegalArgumentException if {@code hhmmss} is malformed
     */
    public static long schedule(BotContext ctx, FrameWriter writer, String label, String hhmmss, GroupTask task) {
        DailyAt at = DailyAt.parse(hhmmss);
        long id = ctx.getScheduler().addSchedule(at, () -> runOnce(ctx, writer, label, task));
        log.info("[push] {} scheduled daily at {}", label, at.time());
        return id;
    }

    /**
     * One broadcast round.
     *
     * @return ids of the groups the task was run for
     */
    public static List<Long> runOnce(BotContext ctx, FrameWriter writer, String label, GroupTask task)
            throws InterruptedException {
        List<OneBotTypes.GroupInfo> groups;
        try {
            groups = OneBotApi.getGroupList(ctx, writer, false);
        } catch (OneBotApiException e) {
            log.error("[push] {}: failed to fetch group list: {}", label, e.getMessage());
            return List.of();
        }
        List<Long> targets = new ArrayList<>();
        if (groups != null) {
            for (OneBotTypes.GroupInfo group : groups) {
                if (ctx.getConfig().allowsGroup(group.groupId())) {
                    targets.add(group.groupId());
                }
            }
        }
        long delayMs = ctx.getConfig().read(c -> c.getPush().getGroupDelayMs());
        log.info("[push] {}: pushing to {} group(s)", label, targets.size());

        for (int i = 0; i < targets.size(); i++) {
            long groupId = targets.get(i);
            try {
                task.run(groupId, ctx, writer);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                log.warn("[push] {}: group {} failed: {}", label, groupId, e.getMessage());
            }
            if (i < targets.size() - 1 && delayMs > 0) {
                Thread.sleep(delayMs);
            }
        }
        return targets;
    }
}
