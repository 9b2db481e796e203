package com.flow.discovery.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flow.discovery.service.tree.ProcessTree;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Nested JSON form of a process tree node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class TreeNodeResponse {

    /**
     * SEQUENCE, XOR, PARALLEL, LOOP, ACTIVITY or TAU.
     */
    private String type;

    /**
     * Activity label (ACTIVITY nodes only).
     */
    private String label;

    private List<TreeNodeResponse> children;

    public static TreeNodeResponse from(ProcessTree tree) {
        return TreeNodeResponse.builder()
                .type(tree.operator().name())
                .label(tree.label())
                .children(tree.children().stream().map(TreeNodeResponse::from).toList())
                .build();
    }
}
