package org.explorerscript.decompiler.marker;

/**
 * The label joins the branches of an if.
 *
 * @param ifId The id of the if that ends here.
 */
public record IfEnd(int ifId) implements LabelMarker {

    @Override
    public String toString() {
        return "IF(" + ifId + ")";
    }
}
