package com.challenges.tslgen.output;

import com.challenges.tslgen.generator.Frame;
import com.challenges.tslgen.generator.GeneratorResult;
import com.challenges.tslgen.model.Category;
import com.challenges.tslgen.model.Choice;
import com.challenges.tslgen.model.FrameType;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import org.eclipse.collections.api.tuple.Pair;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

public class FrameFormatter {
    private static final String RESET = "\u001B[0m";
    private static final String BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";

    private static final String NO_CHOICE = "<n/a>";

    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;
    private final boolean colorOutput;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public FrameFormatter(boolean prettyPrint, boolean colorOutput) {
        this.prettyPrint = prettyPrint;
        this.colorOutput = colorOutput;
    }

    public String format(GeneratorResult result, OutputFormat outputFormat) {
        return switch (outputFormat) {
            case TEXT -> formatText(result);
            case JSON -> formatJson(result);
        };
    }

    public String formatSummary(GeneratorResult result) {
        return colorize(GREEN, result.toSummaryString());
    }

    /** Frames as text blocks, each followed by a blank line. */
    public String formatText(GeneratorResult result) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (Frame frame : result.frames()) {
            formatFrame(frame, sb);
            sb.append('\n');
        }
        return sb.toString();
    }

    public String formatFrame(Frame frame) {
        StringBuilder sb = new StringBuilder(128);
        formatFrame(frame, sb);
        return sb.toString();
    }

    private void formatFrame(Frame frame, StringBuilder sb) {
        sb.append(colorize(BOLD_CYAN, "Test Case " + padRight(Integer.toString(frame.number()), 3)));

        if (!frame.isNormal()) {
            String color = frame.type() == FrameType.ERROR ? RED : YELLOW;
            sb.append("\t\t").append(colorize(color, "<" + frame.type().label() + ">"));
            if (frame.branch() != null) {
                sb.append("  (follows [").append(frame.branch().label()).append("])");
            }
            sb.append('\n');

            Pair<Category, Choice> entry = frame.entries().getFirst();
            sb.append("   ").append(entry.getOne().name()).append(" :  ").append(choiceName(entry.getTwo())).append('\n');
            return;
        }

        sb.append("\t\t(Key = ").append(frame.key()).append(")\n");

        int width = frame.entries().collectInt(entry -> entry.getOne().name().length()).maxIfEmpty(0);
        for (Pair<Category, Choice> entry : frame.entries()) {
            sb.append("   ")
              .append(padRight(entry.getOne().name(), width))
              .append(" :  ")
              .append(choiceName(entry.getTwo()))
              .append('\n');
        }
    }

    /** Frames as a JSON array; colors never apply. */
    public String formatJson(GeneratorResult result) {
        StringWriter out = new StringWriter();
        try (JsonGenerator json = factory.createGenerator(out)) {
            if (prettyPrint) {
                json.useDefaultPrettyPrinter();
            }
            json.writeStartArray();
            for (Frame frame : result.frames()) {
                writeFrame(frame, json);
            }
            json.writeEndArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write frames as JSON", e);
        }
        return out.toString();
    }

    private void writeFrame(Frame frame, JsonGenerator json) throws IOException {
        json.writeStartObject();
        json.writeNumberField("number", frame.number());
        json.writeStringField("type", frame.type().label());
        if (frame.key() != null) {
            json.writeStringField("key", frame.key());
        }
        if (frame.branch() != null) {
            json.writeStringField("branch", frame.branch().label());
        }
        json.writeObjectFieldStart("choices");
        for (Pair<Category, Choice> entry : frame.entries()) {
            json.writeFieldName(entry.getOne().name());
            if (entry.getTwo() == null) {
                json.writeNull();
            } else {
                json.writeString(entry.getTwo().name());
            }
        }
        json.writeEndObject();
        json.writeEndObject();
    }

    private static String choiceName(Choice choice) {
        return choice == null ? NO_CHOICE : choice.name();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        return s + " ".repeat(width - s.length());
    }

    private String colorize(String color, String text) {
        return colorOutput ? color + text + RESET : text;
    }
}
