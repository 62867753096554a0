package com.tale.script.plugins;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;

/**
 * TaleDatetimePlugin
 *
 * The {@code datetime} module. Dates come back as text so they print and
 * compare without a date type; the clock is the run's, so tests can fix it.
 */
public final class TaleDatetimePlugin {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private TaleDatetimePlugin() {}

    public static void register(CapabilityTable.Builder builder) {
        builder.module("datetime")
                .function("now", (ctx, args) -> {
                    Args.require("datetime.now", args, 0);
                    return Value.text(LocalDateTime.now(ctx.clock()).format(DATE_TIME));
                })
                .function("today", (ctx, args) -> {
                    Args.require("datetime.today", args, 0);
                    return Value.text(LocalDateTime.now(ctx.clock()).format(DATE));
                })
                .function("time", (ctx, args) -> {
                    Args.require("datetime.time", args, 0);
                    return Value.text(LocalDateTime.now(ctx.clock()).format(TIME));
                })
                .function("year", (ctx, args) -> {
                    Args.require("datetime.year", args, 0);
                    return Value.integer(LocalDateTime.now(ctx.clock()).getYear());
                })
                .function("month", (ctx, args) -> {
                    Args.require("datetime.month", args, 0);
                    return Value.integer(LocalDateTime.now(ctx.clock()).getMonthValue());
                })
                .function("day", (ctx, args) -> {
                    Args.require("datetime.day", args, 0);
                    return Value.integer(LocalDateTime.now(ctx.clock()).getDayOfMonth());
                })
                .function("weekday", (ctx, args) -> {
                    // Monday is 0
                    Args.require("datetime.weekday", args, 0);
                    return Value.integer(LocalDateTime.now(ctx.clock()).getDayOfWeek().getValue() - 1);
                })
                .function("timestamp", (ctx, args) -> {
                    Args.require("datetime.timestamp", args, 0);
                    return Value.decimal(ctx.clock().millis() / 1000.0);
                });
    }
}
