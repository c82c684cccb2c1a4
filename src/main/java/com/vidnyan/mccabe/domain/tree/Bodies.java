package com.vidnyan.mccabe.domain.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Bodies {

    private Bodies() {
    }

    /**
     * Null-tolerant immutable copy. Null elements survive; the dispatcher skips them.
     */
    static List<SyntaxNode> copyOf(List<? extends SyntaxNode> body) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(body));
    }
}
