package org.kleis.verify.solvers.isabelle;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Isabelle 服务器发来的一条消息：种类前缀加可选的 JSON 体。
 * 同步回复是 OK / ERROR，异步任务的进度和结果是 NOTE / FINISHED / FAILED。
 * @author Ayalyt
 */
@Getter
public final class IsabelleMessage {

    public enum Kind {
        OK, ERROR, RUNNING, NOTE, FINISHED, FAILED, UNKNOWN
    }

    private static final Kind[] PREFIXED = {Kind.OK, Kind.NOTE, Kind.FINISHED, Kind.FAILED, Kind.ERROR, Kind.RUNNING};

    private final Kind kind;
    // 不是合法 JSON 的文本保存为 JsonPrimitive 字符串
    private final JsonElement body;

    private IsabelleMessage(Kind kind, JsonElement body) {
        this.kind = kind;
        this.body = body;
    }

    public static IsabelleMessage of(Kind kind, JsonElement body) {
        return new IsabelleMessage(kind, body == null ? JsonNull.INSTANCE : body);
    }

    /**
     * 解析一行消息。没有已知前缀时尝试把整行作为 JSON，得到 UNKNOWN 种类。
     * @return 空行或无法识别的行返回 null。
     */
    public static IsabelleMessage parse(String line) {
        String trimmed = StringUtils.trimToEmpty(line);
        if (trimmed.isEmpty()) {
            return null;
        }
        for (Kind kind : PREFIXED) {
            String prefix = kind.name();
            if (trimmed.startsWith(prefix)) {
                return of(kind, parseBody(trimmed.substring(prefix.length()).trim()));
            }
        }
        try {
            return of(Kind.UNKNOWN, JsonParser.parseString(trimmed));
        } catch (JsonSyntaxException e) {
            return null;
        }
    }

    private static JsonElement parseBody(String text) {
        if (text.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        try {
            return JsonParser.parseString(text);
        } catch (JsonSyntaxException e) {
            return new JsonPrimitive(text);
        }
    }

    public boolean isObject() {
        return body.isJsonObject();
    }

    public JsonObject asObject() {
        return body.isJsonObject() ? body.getAsJsonObject() : new JsonObject();
    }

    /**
     * @return JSON 对象中的字符串字段；不存在或不是字符串时返回 null。
     */
    public String getString(String field) {
        return stringField(asObject(), field);
    }

    /**
     * @return 异步任务编号。RUNNING 回复的体就是任务编号文本。
     */
    public String taskId() {
        if (kind == Kind.RUNNING && body.isJsonPrimitive()) {
            return body.getAsString();
        }
        return getString("task");
    }

    /**
     * @return 消息文本：JSON 的 message 字段，或纯文本体。
     */
    public String text() {
        if (body.isJsonPrimitive()) {
            return body.getAsString();
        }
        String message = getString("message");
        return message != null ? message : body.toString();
    }

    static String stringField(JsonObject obj, String field) {
        JsonElement e = obj.get(field);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString() ? e.getAsString() : null;
    }

    @Override
    public String toString() {
        return body.isJsonNull() ? kind.name() : kind + " " + body;
    }
}
