package org.explorerscript.ssb.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.explorerscript.ssb.SsbOpCode;
import org.explorerscript.ssb.SsbOpParam;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the routines of an SSB script from a JSON dump, as written by the binary reader's debug output.
 * <p>
 * Format:
 * <pre>{@code
 * {
 *   "routines": [
 *     [
 *       {"offset": 0, "opCode": "BranchValue", "opCodeId": 12, "params": ["$SCENARIO_MAIN", 0, 3, 50]},
 *       {"offset": 5, "opCode": "message_Talk", "params": {"text": "Hello"}}
 *     ]
 *   ]
 * }
 * }</pre>
 * Integer parameters are JSON numbers, strings starting with {@code $} are named constants,
 * other strings are plain strings. {@code params} is an array for positional parameters or an
 * object for named ones. {@code opCodeId} is optional.
 */
public class RoutineDumpReader {

    private static final String CONSTANT_PREFIX = "$";

    /**
     * Reads a dump file.
     *
     * @param file The JSON file.
     * @return The operations of every routine, in routine order.
     * @throws IOException if the file can not be read or is not a valid dump.
     */
    public List<List<SsbOperation>> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Reads a dump.
     *
     * @param reader The JSON source.
     * @return The operations of every routine, in routine order.
     * @throws IOException if the source can not be read or is not a valid dump.
     */
    public List<List<SsbOperation>> read(Reader reader) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON in routine dump: " + e.getMessage(), e);
        }
        if (!root.isJsonObject() || !root.getAsJsonObject().has("routines")
                || !root.getAsJsonObject().get("routines").isJsonArray()) {
            throw new IOException("Routine dump must be an object with a 'routines' array.");
        }

        List<List<SsbOperation>> routines = new ArrayList<>();
        JsonArray routinesJson = root.getAsJsonObject().getAsJsonArray("routines");
        for (int r = 0; r < routinesJson.size(); r++) {
            JsonElement routineJson = routinesJson.get(r);
            if (!routineJson.isJsonArray()) {
                throw new IOException("Routine " + r + " must be an array of operations.");
            }
            List<SsbOperation> ops = new ArrayList<>();
            for (JsonElement opJson : routineJson.getAsJsonArray()) {
                ops.add(readOperation(opJson, r));
            }
            routines.add(ops);
        }
        return routines;
    }

    private SsbOperation readOperation(JsonElement json, int routine) throws IOException {
        if (!json.isJsonObject()) {
            throw new IOException("Operation in routine " + routine + " must be an object: " + json);
        }
        JsonObject obj = json.getAsJsonObject();
        if (!obj.has("offset") || !obj.has("opCode")) {
            throw new IOException("Operation in routine " + routine + " needs 'offset' and 'opCode': " + obj);
        }
        int offset = readInt(obj.get("offset"), "offset");
        int opCodeId = obj.has("opCodeId") ? readInt(obj.get("opCodeId"), "opCodeId") : 0;
        String opName = readString(obj.get("opCode"), "opCode");

        SsbOpParams params;
        JsonElement paramsJson = obj.get("params");
        if (paramsJson == null || paramsJson.isJsonNull()) {
            params = SsbOpParams.of(List.of());
        } else if (paramsJson.isJsonArray()) {
            List<SsbOpParam> values = new ArrayList<>();
            for (JsonElement p : paramsJson.getAsJsonArray()) {
                values.add(readParam(p, opName));
            }
            params = SsbOpParams.of(values);
        } else if (paramsJson.isJsonObject()) {
            Map<String, SsbOpParam> values = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : paramsJson.getAsJsonObject().entrySet()) {
                values.put(entry.getKey(), readParam(entry.getValue(), opName));
            }
            params = SsbOpParams.named(values);
        } else {
            throw new IOException("Parameters of " + opName + " must be an array or an object.");
        }
        return new SsbOperation(offset, new SsbOpCode(opCodeId, opName), params);
    }

    private SsbOpParam readParam(JsonElement json, String opName) throws IOException {
        if (json.isJsonPrimitive()) {
            JsonPrimitive primitive = json.getAsJsonPrimitive();
            if (primitive.isNumber()) {
                return new SsbOpParam.IntParam(readInt(primitive, opName + " parameter"));
            }
            if (primitive.isString()) {
                String text = primitive.getAsString();
                if (text.startsWith(CONSTANT_PREFIX) && text.length() > CONSTANT_PREFIX.length()) {
                    return new SsbOpParam.ConstantParam(text.substring(CONSTANT_PREFIX.length()));
                }
                return new SsbOpParam.StringParam(text);
            }
        }
        throw new IOException("Unsupported parameter value for " + opName + ": " + json);
    }

    private static String readString(JsonElement json, String what) throws IOException {
        if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isString()) {
            throw new IOException("'" + what + "' must be a string: " + json);
        }
        return json.getAsString();
    }

    private static int readInt(JsonElement json, String what) throws IOException {
        if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isNumber()) {
            throw new IOException("'" + what + "' must be an integer: " + json);
        }
        BigDecimal value = json.getAsBigDecimal();
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IOException("'" + what + "' must be an integer: " + json, e);
        }
    }
}
