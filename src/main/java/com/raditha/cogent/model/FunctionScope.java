package com.raditha.cogent.model;

import com.raditha.cogent.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Working state of one open function during a scoring traversal.
 * <p>
 * The scope owns its nesting regions: sub-trees that raise the nesting level while
 * the traversal is inside them. A region is consumed the first time it is left.
 */
public final class FunctionScope {

    private final SyntaxNode node;
    private final String name;
    private final List<ComplexityPoint> cyclomaticPoints = new ArrayList<>();
    private final List<ComplexityPoint> cognitivePoints = new ArrayList<>();
    private final Set<SyntaxNode> nestingRegions = Collections.newSetFromMap(new IdentityHashMap<>());
    private int nestingLevel;
    private boolean recursiveCall;

    public FunctionScope(SyntaxNode node, String name) {
        this.node = node;
        this.name = name;
    }

    public SyntaxNode node() {
        return node;
    }

    public String name() {
        return name;
    }

    public void addCyclomatic(ComplexityPoint point) {
        cyclomaticPoints.add(point);
    }

    public void addCognitive(ComplexityPoint point) {
        cognitivePoints.add(point);
    }

    public List<ComplexityPoint> cyclomaticPoints() {
        return Collections.unmodifiableList(cyclomaticPoints);
    }

    public List<ComplexityPoint> cognitivePoints() {
        return Collections.unmodifiableList(cognitivePoints);
    }

    public int nestingLevel() {
        return nestingLevel;
    }

    public void markNestingRegion(SyntaxNode region) {
        nestingRegions.add(region);
    }

    /**
     * Called for every node the traversal enters while this scope is current.
     */
    public void enterRegion(SyntaxNode node) {
        if (nestingRegions.contains(node)) {
            nestingLevel++;
        }
    }

    /**
     * Called for every node the traversal leaves while this scope is current.
     */
    public void exitRegion(SyntaxNode node) {
        if (nestingRegions.remove(node)) {
            nestingLevel--;
        }
    }

    public void markRecursiveCall() {
        recursiveCall = true;
    }

    public boolean hasRecursiveCall() {
        return recursiveCall;
    }
}
