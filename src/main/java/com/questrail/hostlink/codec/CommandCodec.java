package com.questrail.hostlink.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hostlink.api.Command;
import com.questrail.hostlink.api.CommandResponse;
import com.questrail.hostlink.api.Transport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandCodec
 * =============================================================================
 * Translates between wire bytes and semantic command/response values. Shared by
 * both listeners and the client; it performs no I/O.
 *
 * <h2>Wire format</h2>
 * <pre>
 *   request:  {"type": &lt;name&gt;, "params": {...}, "id": &lt;optional&gt;}
 *   success:  {"status": "success", "result": &lt;any&gt;, "id": &lt;if given&gt;}
 *   error:    {"status": "error", "message": &lt;string&gt;, "id": &lt;if given&gt;}
 * </pre>
 * All documents are UTF-8 JSON. A missing or {@code null} {@code params} member
 * decodes as an empty object.
 */
public final class CommandCodec
{
    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CommandCodec() {
        this(Jsons.mapper());
    }

    public CommandCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Decode one complete wire message into a command.
     *
     * @throws CommandDecodeException if the payload is not a well-formed command
     */
    public Command decodeCommand(byte[] payload, Transport transport) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(transport, "transport");

        JsonNode root = readTree(payload);
        if (root == null || !root.isObject()) {
            throw new CommandDecodeException("Command must be a JSON object");
        }

        JsonNode type = root.get("type");
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw new CommandDecodeException("Command is missing a string 'type'");
        }

        JsonNode paramsNode = root.get("params");
        Map<String, Object> params;
        if (paramsNode == null || paramsNode.isNull()) {
            params = Map.of();
        }
        else if (paramsNode.isObject()) {
            params = mapper.convertValue(paramsNode, PARAMS_TYPE);
        }
        else {
            throw new CommandDecodeException("Command 'params' must be a JSON object");
        }

        JsonNode id = root.get("id");
        Optional<Object> correlation = (id == null || id.isNull())
            ? Optional.empty()
            : Optional.of(mapper.convertValue(id, Object.class));

        return new Command(type.asText(), params, transport, correlation);
    }

    public byte[] encodeCommand(String name, Map<String, Object> params) {
        Objects.requireNonNull(name, "name");
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", name);
        out.put("params", params == null ? Map.of() : params);
        return write(out);
    }

    /**
     * Encode a response, echoing the request correlation id when one was given.
     *
     * @throws IllegalStateException if the result is not serializable
     */
    public byte[] encodeResponse(CommandResponse response, Optional<Object> correlation) {
        Objects.requireNonNull(response, "response");
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", response.status().wireName());
        if (response.isSuccess()) {
            out.put("result", response.result());
        }
        else {
            out.put("message", response.message());
        }
        correlation.ifPresent(id -> out.put("id", id));
        return write(out);
    }

    public byte[] encodeResponse(CommandResponse response) {
        return encodeResponse(response, Optional.empty());
    }

    /**
     * Decode a response document received by a client.
     *
     * @throws CommandDecodeException if the document is not a valid response
     */
    public CommandResponse decodeResponse(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        JsonNode root = readTree(payload);
        if (root == null || !root.isObject()) {
            throw new CommandDecodeException("Response must be a JSON object");
        }

        JsonNode status = root.get("status");
        if (status == null || !status.isTextual()) {
            throw new CommandDecodeException("Response is missing a string 'status'");
        }

        final CommandResponse.Status parsed;
        try {
            parsed = CommandResponse.Status.fromWireName(status.asText());
        } catch (IllegalArgumentException e) {
            throw new CommandDecodeException(e.getMessage(), e);
        }

        if (parsed == CommandResponse.Status.SUCCESS) {
            JsonNode result = root.get("result");
            return CommandResponse.success(
                result == null || result.isNull() ? null : mapper.convertValue(result, Object.class));
        }

        JsonNode message = root.get("message");
        return CommandResponse.error(
            message == null || message.isNull() ? "Unknown error" : message.asText());
    }

    private JsonNode readTree(byte[] payload) {
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new CommandDecodeException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CommandDecodeException("Unreadable JSON: " + e.getMessage(), e);
        }
    }

    private byte[] write(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode JSON: " + e.getOriginalMessage(), e);
        }
    }
}
