package com.bizsim.drg.model;

import com.bizsim.drg.api.AttributeKind;
import com.bizsim.drg.api.Formula;

import java.util.List;

/**
 * Immutable definition of one attribute.
 *
 * @param block          Owning block name.
 * @param name           Attribute name, unique within the block.
 * @param kind           INPUT or CALCULATED.
 * @param defaultValue   Default value (inputs only, 0 for calculated attributes).
 * @param formula        The formula (calculated only, null for inputs).
 * @param dependencies   Qualified identities of declared dependencies, in declaration order.
 * @param declaredNames  Dependency names exactly as written by the model author.
 * @param index          Declaration index across the whole model.
 */
public record Attribute(String block, String name, AttributeKind kind, double defaultValue, Formula formula,
        List<String> dependencies, List<String> declaredNames, int index) {

    public Attribute {
        dependencies = List.copyOf(dependencies);
        declaredNames = List.copyOf(declaredNames);
    }

    /** Qualified identity, {@code block.name}. */
    public String identity() {
        return qualify(block, name);
    }

    public boolean isInput() {
        return kind == AttributeKind.INPUT;
    }

    public boolean isCalculated() {
        return kind == AttributeKind.CALCULATED;
    }

    static String qualify(String block, String name) {
        return block + "." + name;
    }

    /**
     * Qualifies a dependency reference. References without a block prefix point
     * into the declaring block.
     */
    static String qualifyReference(String declaringBlock, String reference) {
        return reference.indexOf('.') >= 0 ? reference : qualify(declaringBlock, reference);
    }

    @Override
    public String toString() {
        return identity() + "(" + kind + ")";
    }
}
