package com.expecta.protocol;

import java.util.List;

import com.expecta.analyzer.ParseResult;
import com.expecta.analyzer.engine.CdForm;
import com.expecta.analyzer.engine.WordStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON rendering of forms and parse results.
 *
 * <pre>
 * nil      -> null
 * symbol   -> "store"
 * number   -> 3
 * ?x       -> {"var": "x"}
 * frame    -> {"header": "ptrans", "roles": [["actor", ...], ["to", ...]]}
 * list     -> [ ... ]
 * </pre>
 *
 * Roles are pairs rather than object fields so that repeated role names and
 * role order survive.
 */
public final class CdFormCodec {

    private final ObjectMapper om;

    public CdFormCodec() {
        this(new ObjectMapper());
    }

    public CdFormCodec(ObjectMapper om) {
        this.om = om;
    }

    public JsonNode toJson(CdForm form) {
        if (form == null) return om.nullNode();
        switch (form.getType()) {
            case NIL:
                return om.nullNode();
            case SYMBOL:
                return om.getNodeFactory().textNode(form.asSymbol());
            case NUMBER: {
                double d = form.asNumber();
                if (d == Math.rint(d) && Math.abs(d) < 0x1p63) return om.getNodeFactory().numberNode((long) d);
                return om.getNodeFactory().numberNode(d);
            }
            case VARIABLE: {
                ObjectNode v = om.createObjectNode();
                v.put("var", form.variableName());
                return v;
            }
            case FRAME: {
                ObjectNode f = om.createObjectNode();
                f.put("header", form.header());
                ArrayNode roles = f.putArray("roles");
                for (CdForm.Role r : form.roles()) {
                    ArrayNode pair = roles.addArray();
                    pair.add(r.name);
                    pair.add(toJson(r.filler));
                }
                return f;
            }
            case LIST: {
                ArrayNode a = om.createArrayNode();
                for (CdForm item : form.items()) a.add(toJson(item));
                return a;
            }
            default:
                throw new IllegalArgumentException("Unsupported form type: " + form.getType());
        }
    }

    public ObjectNode toJson(ParseResult result) {
        ObjectNode out = om.createObjectNode();
        out.put("ok", result.ok());
        out.put("sentence", String.join(" ", result.words()));
        out.set("concept", toJson(result.concept()));
        out.put("text", result.concept().toString());

        if (!result.ok()) {
            ObjectNode err = out.putObject("error");
            err.put("kind", result.errorKind().tag());
            err.put("message", result.errorMessage());
        }

        ArrayNode unknown = out.putArray("unknownWords");
        for (String w : result.unknownWords()) unknown.add(w);

        ArrayNode steps = out.putArray("steps");
        List<WordStep> ws = result.steps();
        for (WordStep s : ws) {
            ObjectNode n = steps.addObject();
            n.put("word", s.word());
            n.put("known", s.known());
            n.put("fired", s.fired());
            n.put("stackDepth", s.stackDepth());
        }
        return out;
    }

    public String write(JsonNode node, boolean pretty) throws JsonProcessingException {
        if (pretty) {
            return om.copy().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(node);
        }
        return om.writeValueAsString(node);
    }
}
