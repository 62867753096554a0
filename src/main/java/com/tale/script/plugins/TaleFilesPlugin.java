package com.tale.script.plugins;

import java.util.List;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.SandboxFiles;

/**
 * TaleFilesPlugin
 *
 * {@code open}, {@code read}, {@code write} and {@code close} over the run's
 * in-memory workspace. Translated TALE such as
 * {@code open "notes.txt" for writing as f} lands here.
 */
public final class TaleFilesPlugin {

    private TaleFilesPlugin() {}

    public static void register(CapabilityTable.Builder builder) {

        builder.function("open", (ctx, args) -> {
            Args.requireBetween("open", args, 1, 2);
            String path = Args.text("open", args, 0);
            String mode = args.size() == 2 ? Args.text("open", args, 1) : "r";
            return Value.file(ctx.files().open(path, mode));
        });

        builder.function("read", (ctx, args) -> {
            Args.require("read", args, 1);
            return Value.text(ctx.files().read(handle("read", args)));
        });

        builder.function("write", (ctx, args) -> {
            Args.require("write", args, 2);
            ctx.files().write(handle("write", args), args.get(1).toString());
            return Value.nil();
        });

        builder.function("close", (ctx, args) -> {
            Args.require("close", args, 1);
            ctx.files().close(handle("close", args));
            return Value.nil();
        });
    }

    private static SandboxFiles.FileHandle handle(String fn, List<Value> args) {
        Value v = args.get(0);
        if (v.type != Value.Type.FILE) {
            throw TaleException.runtime(fn + "() needs an open file but got " + v.typeName());
        }
        return (SandboxFiles.FileHandle) v.value;
    }
}
