package com.querybreakdown.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.querybreakdown.search.EditNode;
import com.querybreakdown.search.EditType;

/**
 * 对外输出的一步编辑，字段名与编辑器插件读取的 JSON 格式一致。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"error_position", "error_type", "replacedFrom", "replacedTo"})
public record EditDescriptor(
        @JsonProperty("error_position") ErrorPosition position,
        @JsonProperty("error_type") EditType type,
        @JsonProperty("replacedFrom") String replacedFrom,
        @JsonProperty("replacedTo") String replacedTo,
        @JsonIgnore int cost
) {
    public static EditDescriptor from(EditNode node) {
        return new EditDescriptor(ErrorPosition.of(node.getStart(), node.getEnd()), node.getType(),
            node.getReplacedFrom(), node.getReplacedTo(), node.getCost());
    }

    public EditDescriptor shift(int lineOffset, int firstLineColumnOffset) {
        return new EditDescriptor(position.shift(lineOffset, firstLineColumnOffset), type, replacedFrom, replacedTo, cost);
    }
}
