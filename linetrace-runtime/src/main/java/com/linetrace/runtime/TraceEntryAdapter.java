package com.linetrace.runtime;

import com.google.gson.*;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a {@link TraceEntry} as a two-element array {@code [position, snapshot]} and reads it back.
 */
final class TraceEntryAdapter implements JsonSerializer<TraceEntry>, JsonDeserializer<TraceEntry> {

    @Override
    public JsonElement serialize(TraceEntry entry, Type type, JsonSerializationContext ctx) {
        JsonObject snapshot = new JsonObject();
        entry.snapshot().forEach(snapshot::add);

        JsonArray pair = new JsonArray();
        pair.add(entry.position());
        pair.add(snapshot);
        return pair;
    }

    @Override
    public TraceEntry deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
        if (!json.isJsonArray() || json.getAsJsonArray().size() != 2) {
            throw new JsonParseException("Trace entry must be a [position, snapshot] pair: " + json);
        }
        JsonArray pair = json.getAsJsonArray();
        JsonElement position = pair.get(0);
        JsonElement snapshot = pair.get(1);
        if (!position.isJsonPrimitive() || !position.getAsJsonPrimitive().isNumber()) {
            throw new JsonParseException("Trace entry position is not a number: " + position);
        }
        if (!snapshot.isJsonObject()) {
            throw new JsonParseException("Trace entry snapshot is not an object: " + snapshot);
        }
        Map<String, JsonElement> values = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : snapshot.getAsJsonObject().entrySet()) {
            values.put(e.getKey(), e.getValue());
        }
        return new TraceEntry(position.getAsInt(), values);
    }

    static Gson gson() {
        return new GsonBuilder()
            .registerTypeAdapter(TraceEntry.class, new TraceEntryAdapter())
            .setPrettyPrinting()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .create();
    }
}
