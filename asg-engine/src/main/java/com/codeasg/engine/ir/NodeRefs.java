package com.codeasg.engine.ir;

import com.codeasg.engine.grammar.Language;

/**
 * Generates stable string references for exported nodes and symbols:
 *   <language>::<unit>::<node id>
 *   <language>::<unit>::symbol:<symbol id>
 */
public class NodeRefs {

    public static String forNode(Language language, String unit, int nodeId) {
        return language.id() + "::" + unit + "::" + nodeId;
    }

    public static String forSymbol(Language language, String unit, int symbolId) {
        return language.id() + "::" + unit + "::symbol:" + symbolId;
    }

    /**
     * Node id of a reference produced by {@link #forNode}. The unit may itself contain "::".
     *
     * @throws IllegalArgumentException if {@code ref} is not a node reference
     */
    public static int nodeId(String ref) {
        int cut = ref.lastIndexOf("::");
        if (cut < 0 || ref.indexOf("::") == cut) {
            throw new IllegalArgumentException("Not a node reference: " + ref);
        }
        try {
            return Integer.parseInt(ref.substring(cut + 2));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a node reference: " + ref, e);
        }
    }
}
