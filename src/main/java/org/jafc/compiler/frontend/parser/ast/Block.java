package org.jafc.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered sequence of block items. The order is the execution and declaration order.
 *
 * @param items The items of the block; individual entries may be null.
 */
public record Block(List<BlockItem> items) {

    public Block {
        items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static Block of(BlockItem... items) {
        List<BlockItem> list = new ArrayList<>();
        Collections.addAll(list, items);
        return new Block(list);
    }

    public static Block empty() {
        return new Block(List.of());
    }

    public int size() {
        return items.size();
    }
}
