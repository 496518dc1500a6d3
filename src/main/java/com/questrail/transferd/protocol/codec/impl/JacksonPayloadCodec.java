package com.questrail.transferd.protocol.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.questrail.transferd.protocol.codec.Envelope;
import com.questrail.transferd.protocol.codec.PayloadCodec;
import com.questrail.transferd.protocol.codec.ProtocolException;
import com.questrail.transferd.protocol.model.DaemonMessage;
import com.questrail.transferd.protocol.model.Event;
import com.questrail.transferd.protocol.model.Fault;
import com.questrail.transferd.protocol.model.FaultKind;
import com.questrail.transferd.protocol.model.Request;
import com.questrail.transferd.protocol.model.Response;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JacksonPayloadCodec
 * -----------------------------------------------------------------------------
 * JSON payloads via Jackson.
 *
 * <pre>
 *   request   {"id":7,"method":"job.add","args":["uri"],"kwargs":{"paused":true}}
 *   response  {"id":7,"result":{...}}
 *             {"id":7,"fault":{"kind":"AuthError","message":"..."}}
 *   event     {"name":"job.status","value":{...},"timestamp":1700000000000}
 * </pre>
 *
 * <p>Decoding is strict about structure (missing or mistyped fields are
 * protocol errors) and lenient about extra fields, which are ignored.</p>
 */
public final class JacksonPayloadCodec implements PayloadCodec
{
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonPayloadCodec()
    {
        this(defaultMapper());
    }

    public JacksonPayloadCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper()
    {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    @Override
    public DaemonMessage decode(Envelope envelope)
    {
        final JsonNode root;
        try {
            root = mapper.readTree(envelope.payload());
        } catch (IOException e) {
            throw new ProtocolException("Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Payload must be a JSON object");
        }

        return switch (envelope.type()) {
            case REQUEST -> decodeRequest(root);
            case RESPONSE -> decodeResponse(root);
            case EVENT -> decodeEvent(root);
        };
    }

    private Request decodeRequest(JsonNode root)
    {
        long id = requireId(root);

        JsonNode method = root.get("method");
        if (method == null || !method.isTextual() || method.asText().isEmpty()) {
            throw new ProtocolException("Request " + id + " has no method name");
        }

        JsonNode argsNode = root.get("args");
        List<Object> args = List.of();
        if (argsNode != null && !argsNode.isNull()) {
            if (!argsNode.isArray()) {
                throw new ProtocolException("Request " + id + ": args must be an array");
            }
            args = mapper.convertValue(argsNode, LIST_TYPE);
        }

        JsonNode kwargsNode = root.get("kwargs");
        Map<String, Object> kwargs = Map.of();
        if (kwargsNode != null && !kwargsNode.isNull()) {
            if (!kwargsNode.isObject()) {
                throw new ProtocolException("Request " + id + ": kwargs must be an object");
            }
            kwargs = mapper.convertValue(kwargsNode, MAP_TYPE);
        }

        return new Request(id, method.asText(), args, kwargs);
    }

    private Response decodeResponse(JsonNode root)
    {
        long id = requireId(root);

        JsonNode faultNode = root.get("fault");
        if (faultNode != null && !faultNode.isNull()) {
            String kindName = faultNode.path("kind").asText("");
            FaultKind kind = FaultKind.fromWireName(kindName)
                    .orElseThrow(() -> new ProtocolException("Unknown fault kind '" + kindName + "'"));
            return Response.failure(id, new Fault(kind, faultNode.path("message").asText("")));
        }

        JsonNode resultNode = root.get("result");
        Object result = resultNode == null || resultNode.isNull()
                ? null
                : mapper.convertValue(resultNode, Object.class);
        return Response.success(id, result);
    }

    private Event decodeEvent(JsonNode root)
    {
        JsonNode name = root.get("name");
        if (name == null || !name.isTextual()) {
            throw new ProtocolException("Event has no name");
        }
        JsonNode ts = root.get("timestamp");
        if (ts == null || !ts.canConvertToLong()) {
            throw new ProtocolException("Event '" + name.asText() + "' has no timestamp");
        }
        JsonNode valueNode = root.get("value");
        Object value = valueNode == null || valueNode.isNull()
                ? null
                : mapper.convertValue(valueNode, Object.class);
        return new Event(name.asText(), value, Instant.ofEpochMilli(ts.asLong()));
    }

    private static long requireId(JsonNode root)
    {
        JsonNode id = root.get("id");
        if (id == null || !id.isIntegralNumber() || !id.canConvertToLong()) {
            throw new ProtocolException("Missing or non-integral message id");
        }
        return id.asLong();
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Override
    public Envelope encode(DaemonMessage message, boolean compress)
    {
        ObjectNode root = mapper.createObjectNode();

        if (message instanceof Request request) {
            root.put("id", request.requestId());
            root.put("method", request.operation());
            root.set("args", mapper.valueToTree(request.args()));
            root.set("kwargs", mapper.valueToTree(request.kwargs()));
        }
        else if (message instanceof Response response) {
            root.put("id", response.requestId());
            if (response.isFault()) {
                ObjectNode fault = root.putObject("fault");
                fault.put("kind", response.fault().kind().wireName());
                fault.put("message", response.fault().message());
            }
            else {
                root.set("result", mapper.valueToTree(response.result()));
            }
        }
        else if (message instanceof Event event) {
            root.put("name", event.name());
            root.set("value", mapper.valueToTree(event.value()));
            root.put("timestamp", event.timestamp().toEpochMilli());
        }

        try {
            byte[] payload = mapper.writeValueAsBytes(root);
            return new Envelope(EnvelopeFraming.PROTOCOL_VERSION, message.type(), compress, payload);
        } catch (JsonProcessingException e) {
            // The tree was built from normalized values; this is a defect, not bad input.
            throw new IllegalStateException("Failed to serialize " + message.type() + " payload", e);
        }
    }

    @Override
    public Object normalize(Object value)
    {
        if (value == null) {
            return null;
        }
        return mapper.convertValue(value, Object.class);
    }
}
