package com.csvgroupdiff;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

/**
 * JSON form of reports and timings. Cells are written as plain JSON values:
 * numbers as numbers, text as strings, missing as null.
 */
public final class ResultJson {
    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(CellValue.class, new CellValueAdapter())
            .serializeNulls()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private ResultJson() {}

    public static Gson gson() {
        return GSON;
    }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    public static void write(Object value, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file)) {
            GSON.toJson(value, out);
        }
    }

    static final class CellValueAdapter extends TypeAdapter<CellValue> {
        @Override
        public void write(JsonWriter out, CellValue value) throws IOException {
            if (value == null || value.isMissing()) {
                out.nullValue();
            } else if (value.isNumber()) {
                out.value(value.number());
            } else {
                out.value(value.text());
            }
        }

        @Override
        public CellValue read(JsonReader in) throws IOException {
            JsonToken token = in.peek();
            if (token == JsonToken.NULL) {
                in.nextNull();
                return CellValue.missing();
            }
            if (token == JsonToken.NUMBER) {
                return CellValue.number(in.nextString());
            }
            return CellValue.of(in.nextString());
        }
    }
}
