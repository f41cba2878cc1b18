package com.shapetea.constraint;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shapetea.ir.CodeSource;

/**
 * JSON dump of one path's constraint set, the document handed to an external solver:
 *
 * <pre>
 * { "ctrPool": [ {"id", "type", "message", "source", "str"} ... ],
 *   "hardCtr": [..], "softCtr": [..], "pathCtr": [..] }
 * </pre>
 *
 * The index arrays point into {@code ctrPool}. {@code str} is the constraint rendered after
 * simplification against the set's caches.
 */
public final class ConstraintJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ConstraintJson() {
    }

    public static ObjectNode toNode(ConstraintSet ctrSet) {
        ObjectNode root = om.createObjectNode();
        ArrayNode pool = root.putArray("ctrPool");

        List<Constraint> simplified = ctrSet.getConstraints();
        for (Constraint ctr : simplified) {
            ObjectNode item = pool.addObject();
            String str = ctr.toString();
            String pos = ctr.source == null ? "" : ctr.source.toString();
            item.put("id", ctr.id);
            item.put("type", ctr.type().name());
            item.put("message", (ctr.message == null ? "constraint" : ctr.message) + " at <" + pos + ">\n  " + str);
            if (ctr.source == null) {
                item.putNull("source");
            } else {
                item.set("source", sourceNode(ctr.source));
            }
            item.put("str", str);
        }

        ArrayNode hard = root.putArray("hardCtr");
        for (int idx : ctrSet.getHardIds()) hard.add(idx);
        ArrayNode soft = root.putArray("softCtr");
        for (int idx : ctrSet.getSoftIds()) soft.add(idx);
        ArrayNode path = root.putArray("pathCtr");
        for (int idx : ctrSet.getPathIds()) path.add(idx);
        return root;
    }

    public static String toJson(ConstraintSet ctrSet) {
        try {
            return om.writeValueAsString(toNode(ctrSet));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize constraint set", e);
        }
    }

    private static ObjectNode sourceNode(CodeSource source) {
        ObjectNode node = om.createObjectNode();
        if (source instanceof CodeSource.FileRange) {
            CodeSource.FileRange r = (CodeSource.FileRange) source;
            node.put("fileId", r.fileId);
            ObjectNode range = node.putObject("range");
            ObjectNode start = range.putObject("start");
            start.put("line", r.startLine);
            start.put("character", r.startCol);
            ObjectNode end = range.putObject("end");
            end.put("line", r.endLine);
            end.put("character", r.endCol);
        } else {
            node.put("node", source.toString());
        }
        return node;
    }
}
