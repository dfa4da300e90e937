package com.codeasg.engine.dfg;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reaching-definition facts for every control-flow graph of a unit.
 *
 * @param reachingDefs  def-to-use pairs, deduplicated, ordered by def then use
 * @param itemOf        occurrence node to the statement item (or entry node) it was evaluated in
 * @param defs          occurrences that define a variable
 * @param uses          occurrences that use a variable
 */
public record DataFlow(List<DefUse> reachingDefs, Map<Integer, Integer> itemOf, Set<Integer> defs, Set<Integer> uses) {

    public DataFlow {
        reachingDefs = List.copyOf(reachingDefs);
        itemOf = Collections.unmodifiableMap(itemOf);
        defs = Set.copyOf(defs);
        uses = Set.copyOf(uses);
    }
}
