package com.tale.script.plugins;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.SandboxContext;

/**
 * TaleCsvPlugin
 *
 * Rows of text in and out of CSV: the {@code csv} module ({@code parse},
 * {@code format}) and the file helpers {@code read_csv(path)} /
 * {@code write_csv(rows, path)}. Every cell is read back as text.
 */
public final class TaleCsvPlugin {

    private static final CsvMapper csv = new CsvMapper();

    private TaleCsvPlugin() {}

    public static void register(CapabilityTable.Builder builder) {

        builder.module("csv")
                .function("parse", (ctx, args) -> {
                    Args.require("csv.parse", args, 1);
                    return parse(ctx, Args.text("csv.parse", args, 0));
                })
                .function("format", (ctx, args) -> {
                    Args.require("csv.format", args, 1);
                    String out = format(args.get(0));
                    ctx.checkText(out.length());
                    return Value.text(out);
                });

        builder.function("read_csv", (ctx, args) -> {
            Args.require("read_csv", args, 1);
            return parse(ctx, ctx.files().readAll(Args.text("read_csv", args, 0)));
        });

        builder.function("write_csv", (ctx, args) -> {
            Args.require("write_csv", args, 2);
            ctx.files().writeAll(Args.text("write_csv", args, 1), format(args.get(0)));
            return Value.nil();
        });
    }

    static Value parse(SandboxContext ctx, String text) {
        List<Value> rows = new ArrayList<>();
        if (text.isEmpty()) return Value.list(rows);
        try (MappingIterator<List<String>> it = csv.readerForListOf(String.class)
                .with(CsvSchema.emptySchema())
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(text)) {
            while (it.hasNextValue()) {
                List<Value> row = new ArrayList<>();
                for (String cell : it.nextValue()) row.add(Value.text(cell == null ? "" : cell));
                rows.add(Value.list(row));
                ctx.checkSize(rows.size());
            }
        } catch (IOException e) {
            throw TaleException.runtime("Invalid CSV: " + e.getMessage());
        }
        return Value.list(rows);
    }

    static String format(Value rows) {
        if (!rows.isIterable() || rows.type == Value.Type.TEXT) {
            throw TaleException.runtime("CSV needs a list of rows but got " + rows.typeName());
        }
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csv.writer(CsvSchema.emptySchema()).writeValues(out)) {
            Iterator<Value> it = rows.iterator();
            while (it.hasNext()) {
                Value row = it.next();
                if (row.type != Value.Type.LIST && row.type != Value.Type.TUPLE) {
                    throw TaleException.runtime("Each CSV row must be a list, not " + row.typeName());
                }
                List<Value> cells = row.asList();
                String[] line = new String[cells.size()];
                for (int i = 0; i < line.length; i++) line[i] = cells.get(i).toString();
                writer.write(line);
            }
        } catch (IOException e) {
            throw TaleException.runtime("Could not write CSV: " + e.getMessage());
        }
        return out.toString();
    }
}
