package org.kleis.verify.solvers.isabelle;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.kleis.verify.solvers.SolverException;
import org.kleis.verify.solvers.VerificationResult;
import org.kleis.verify.solvers.Witness;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 use_theories 的结果和服务器错误消息分类为 {@link VerificationResult}。
 * Isabelle 不给出反例，Invalid 的见证只包含错误文本。
 */
final class IsabelleResults {

    // 轮询时记录的首个证明错误
    static final String PROOF_ERROR = "_proof_error";

    private IsabelleResults() {
    }

    /**
     * 分类 FINISHED 消息体：节点状态 failed 或未完成、error 级消息、errors 数组都视为 Invalid。
     */
    static VerificationResult fromFinished(JsonObject response) {
        String proofError = IsabelleMessage.stringField(response, PROOF_ERROR);
        if (proofError != null) {
            return invalid(proofError);
        }
        JsonArray nodes = array(response, "nodes");
        if (nodes != null) {
            for (JsonElement element : nodes) {
                if (!element.isJsonObject()) {
                    continue;
                }
                JsonObject node = element.getAsJsonObject();
                JsonElement status = node.get("status");
                if (status != null && status.isJsonObject()) {
                    JsonObject s = status.getAsJsonObject();
                    if (flag(s, "failed")) {
                        return invalid("Proof failed");
                    }
                    if (!flag(s, "finished") && !flag(s, "consolidated")) {
                        return invalid("Proof incomplete");
                    }
                } else if (status != null && status.isJsonPrimitive()) {
                    String text = status.getAsString();
                    if (text.equals("failed") || text.equals("error")) {
                        return invalid(nodeErrors(node, "Proof failed in theory node"));
                    }
                }
                String error = firstError(node);
                if (error != null) {
                    return invalid(error);
                }
            }
            return VerificationResult.valid();
        }
        JsonArray errors = array(response, "errors");
        if (errors != null && !errors.isEmpty()) {
            return invalid(joinMessages(errors));
        }
        return VerificationResult.valid();
    }

    /**
     * 分类同步回复体中的 status 字段。
     */
    static VerificationResult fromStatus(JsonObject response) {
        String status = IsabelleMessage.stringField(response, "status");
        if (status == null) {
            return fromFinished(response);
        }
        return switch (status) {
            case "ok", "finished", "consolidated" -> VerificationResult.valid();
            case "failed", "error" -> invalid(errorText(response));
            default -> VerificationResult.unknown("Isabelle status: " + status);
        };
    }

    /**
     * 分类服务器错误文本。
     * @throws SolverException 翻译后的命题有语法错误（Kind.SYNTAX_ERROR）。
     */
    static VerificationResult fromError(String message) {
        if (message.contains("Failed to finish proof") || message.contains("proof failed")) {
            return invalid("Proof method failed: " + message);
        }
        if (message.contains("Undefined") || message.contains("undefined")) {
            return invalid("Undefined symbol or type: " + message);
        }
        if (message.contains("Type unification failed") || message.contains("type error")) {
            return invalid("Type error in formula: " + message);
        }
        if (message.contains("Timeout") || message.contains("timeout")) {
            return VerificationResult.unknown(message);
        }
        if (message.contains("syntax error") || message.contains("Inner syntax error")) {
            throw new SolverException(SolverException.Kind.SYNTAX_ERROR,
                    "Syntax error in translated formula: " + message);
        }
        return invalid(message);
    }

    /**
     * NOTE 中的这些片段表示证明失败。
     */
    static boolean isProofFailureNote(String message) {
        return message.contains("Failed to finish proof") || message.contains("Failed to apply")
                || message.contains("goal") || message.contains("error");
    }

    private static VerificationResult invalid(String message) {
        return VerificationResult.invalid(Witness.rawOnly(message));
    }

    private static String firstError(JsonObject node) {
        JsonArray messages = array(node, "messages");
        if (messages == null) {
            return null;
        }
        for (JsonElement m : messages) {
            if (m.isJsonObject() && "error".equals(IsabelleMessage.stringField(m.getAsJsonObject(), "kind"))) {
                JsonObject msg = m.getAsJsonObject();
                String text = IsabelleMessage.stringField(msg, "message");
                if (text == null) {
                    text = IsabelleMessage.stringField(msg, "body");
                }
                return text == null ? "Unknown error" : text;
            }
        }
        return null;
    }

    private static String nodeErrors(JsonObject node, String fallback) {
        JsonArray messages = array(node, "messages");
        List<String> errors = new ArrayList<>();
        if (messages != null) {
            for (JsonElement m : messages) {
                if (!m.isJsonObject()) {
                    continue;
                }
                String kind = IsabelleMessage.stringField(m.getAsJsonObject(), "kind");
                String text = IsabelleMessage.stringField(m.getAsJsonObject(), "message");
                if (text != null && ("error".equals(kind) || "warning".equals(kind))) {
                    errors.add(text);
                }
            }
        }
        return errors.isEmpty() ? fallback : String.join("; ", errors);
    }

    private static String errorText(JsonObject response) {
        for (String field : new String[]{"message", "error"}) {
            String text = IsabelleMessage.stringField(response, field);
            if (text != null) {
                return text;
            }
        }
        JsonArray errors = array(response, "errors");
        return errors != null ? joinMessages(errors) : "Proof failed (no details available)";
    }

    private static String joinMessages(JsonArray errors) {
        List<String> parts = new ArrayList<>();
        for (JsonElement e : errors) {
            if (e.isJsonPrimitive()) {
                parts.add(e.getAsString());
            } else if (e.isJsonObject()) {
                String text = IsabelleMessage.stringField(e.getAsJsonObject(), "message");
                if (text != null) {
                    parts.add(text);
                }
            }
        }
        return String.join("; ", parts);
    }

    private static JsonArray array(JsonObject obj, String field) {
        JsonElement e = obj.get(field);
        return e != null && e.isJsonArray() ? e.getAsJsonArray() : null;
    }

    private static boolean flag(JsonObject obj, String field) {
        JsonElement e = obj.get(field);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() && e.getAsBoolean();
    }
}
