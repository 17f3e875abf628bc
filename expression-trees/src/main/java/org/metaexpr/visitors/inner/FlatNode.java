package org.metaexpr.visitors.inner;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.metaexpr.ir.expression.Expression;

/** One visit recorded by {@link Flatten}.
 * @param node   Node visited.
 * @param id     Number of the node; repeated visits of the same node reuse the number.
 * @param level  Depth of the visit; the root has level 0. */
public record FlatNode(Expression node, int id, int level) {
    public void toJson(ObjectNode json) {
        json.put("id", this.id);
        json.put("level", this.level);
        json.put("kind", this.node.getKind().name());
        json.put("type", this.node.type.getName());
        json.put("node", this.node.toString());
    }
}
