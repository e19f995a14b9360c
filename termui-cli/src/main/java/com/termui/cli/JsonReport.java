package com.termui.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.termui.compiler.parser.ParseError;
import termui.runtime.UiHandle;
import termui.runtime.UiValue;
import termui.runtime.session.BlockOutcome;
import termui.runtime.vm.VMResult;

import java.util.Map;

/**
 * --json 输出：每个块的结果和最终的脚本变量
 */
final class JsonReport {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .create();
    private final JsonArray blocks = new JsonArray();
    private final JsonArray outputs = new JsonArray();
    private boolean success = true;

    void addOutcome(String source, BlockOutcome outcome) {
        JsonObject block = new JsonObject();
        block.addProperty("source", source);
        block.addProperty("index", outcome.getIndex());
        block.addProperty("success", outcome.isSuccess());
        block.addProperty("executed", outcome.isExecuted());

        VMResult result = outcome.getResult();
        block.add("returnValue", result != null && result.hasReturnValue()
                ? toJson(result.getReturnValue()) : JsonNull.INSTANCE);
        block.addProperty("iterations", result != null ? result.getIterations() : 0);
        block.addProperty("error", outcome.getError());

        JsonArray parseErrors = new JsonArray();
        for (ParseError error : outcome.getParseErrors()) {
            JsonObject item = new JsonObject();
            item.addProperty("message", error.getMessage());
            item.addProperty("line", error.getLine());
            item.addProperty("column", error.getColumn());
            item.addProperty("offset", error.getOffset());
            parseErrors.add(item);
        }
        block.add("parseErrors", parseErrors);

        blocks.add(block);
        if (!outcome.isSuccess()) {
            success = false;
        }
    }

    void addOutput(String source, String text) {
        JsonObject item = new JsonObject();
        item.addProperty("source", source);
        item.addProperty("text", text);
        outputs.add(item);
    }

    boolean isSuccess() {
        return success;
    }

    String toJson(Map<String, UiValue> variables) {
        JsonObject root = new JsonObject();
        root.addProperty("success", success);
        root.add("blocks", blocks);
        root.add("output", outputs);

        JsonObject vars = new JsonObject();
        for (Map.Entry<String, UiValue> entry : variables.entrySet()) {
            vars.add(entry.getKey(), toJson(entry.getValue()));
        }
        root.add("variables", vars);
        return gson.toJson(root);
    }

    static JsonElement toJson(UiValue value) {
        if (value == null || value.isNull()) {
            return JsonNull.INSTANCE;
        }
        if (value.isNumber()) {
            double d = value.asDouble();
            // 整数值按整数输出
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return new JsonPrimitive((long) d);
            }
            return new JsonPrimitive(d);
        }
        if (value.isBoolean()) {
            return new JsonPrimitive(value.isTruthy());
        }
        if (value.isHandle()) {
            UiHandle handle = (UiHandle) value;
            JsonObject object = new JsonObject();
            object.addProperty("type", handle.getType());
            object.addProperty("id", handle.getId());
            return object;
        }
        return new JsonPrimitive(value.asString());
    }
}
